package com.kg.core.service.api.controller;

import com.kg.core.service.api.dto.ApiResponse;
import com.kg.core.service.api.dto.BackupRequest;
import com.kg.core.service.api.dto.RestoreBackupRequest;
import com.kg.core.service.config.KnowledgeGraphConfig;
import com.kg.core.service.graph.BackupManifest;
import com.kg.core.service.graph.GraphDescription;
import com.kg.core.service.graph.GraphStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * Controller for graph backups.
 */
@Slf4j
@RestController
@RequestMapping("/graph/backups")
@Tag(name = "Graph Backups", description = "Create, list and restore graph backups")
@RequiredArgsConstructor
public class GraphBackupController {

    private final GraphStore graphStore;
    private final KnowledgeGraphConfig config;

    @PostMapping
    @Operation(summary = "Create backup", description = "Writes the current graph to a timestamped backup file")
    public ResponseEntity<ApiResponse<BackupManifest>> backup(@RequestBody(required = false) BackupRequest request) {
        String description = request != null && request.getDescription() != null
                ? request.getDescription()
                : "Manual backup";
        var manifest = graphStore.backup(description);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(manifest, "Backup created"));
    }

    @GetMapping
    @Operation(summary = "List backups", description = "Lists backup files, oldest first")
    public ResponseEntity<ApiResponse<List<BackupManifest>>> listBackups() {
        return ResponseEntity.ok(ApiResponse.success(graphStore.listBackups()));
    }

    @PostMapping("/restore")
    @Operation(summary = "Restore backup", description = "Replaces the in-memory graph with a backup file")
    public ResponseEntity<ApiResponse<GraphDescription>> restore(@Valid @RequestBody RestoreBackupRequest request) {
        graphStore.restoreFromBackup(Path.of(request.getPath()));
        log.info("Graph restored from {}", request.getPath());
        return ResponseEntity.ok(ApiResponse.success(graphStore.describe(), "Backup restored"));
    }

    @PostMapping("/sync-latest")
    @Operation(summary = "Restore latest backup", description = "Restores the newest backup and saves it as the graph document")
    public ResponseEntity<ApiResponse<BackupManifest>> syncLatest() {
        var manifest = graphStore.syncFromLatestBackup(Path.of(config.getStore().getPath()));
        return ResponseEntity.ok(ApiResponse.success(manifest, "Latest backup restored"));
    }
}
