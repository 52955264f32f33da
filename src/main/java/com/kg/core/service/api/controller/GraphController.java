package com.kg.core.service.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kg.core.service.api.dto.ApiResponse;
import com.kg.core.service.config.KnowledgeGraphConfig;
import com.kg.core.service.graph.GraphDescription;
import com.kg.core.service.graph.GraphStore;
import com.kg.core.service.graph.GraphStoreException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.List;

/**
 * Controller for reading and editing the knowledge graph document.
 */
@Slf4j
@RestController
@RequestMapping("/graph")
@Tag(name = "Knowledge Graph", description = "Read and edit the knowledge graph document")
@RequiredArgsConstructor
public class GraphController {

    private final GraphStore graphStore;
    private final KnowledgeGraphConfig config;

    // ==================== Document ====================

    @GetMapping
    @Operation(summary = "Describe graph", description = "Returns version, timestamps and service/pattern names")
    public ResponseEntity<ApiResponse<GraphDescription>> describe() {
        return ResponseEntity.ok(ApiResponse.success(graphStore.describe()));
    }

    @GetMapping("/nodes/{path}")
    @Operation(summary = "Get node", description = "Returns version, last_updated or a top-level section")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Node found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "501", description = "Unsupported node path")
    })
    public ResponseEntity<ApiResponse<JsonNode>> getNode(
            @Parameter(description = "Top-level node name") @PathVariable String path) {
        log.debug("Getting node: {}", path);
        return ResponseEntity.ok(ApiResponse.success(graphStore.getNode(path)));
    }

    @PutMapping("/nodes/{path}")
    @Operation(summary = "Replace node", description = "Replaces version, last_updated or a whole top-level section")
    public ResponseEntity<ApiResponse<JsonNode>> updateNode(
            @Parameter(description = "Top-level node name") @PathVariable String path,
            @RequestBody JsonNode value) {
        graphStore.updateNode(path, value);
        log.info("Node {} replaced", path);
        return ResponseEntity.ok(ApiResponse.success(graphStore.getNode(path), "Node updated"));
    }

    @GetMapping(value = "/visualization", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Visualize graph", description = "Renders the core services as a mermaid dependency graph")
    public ResponseEntity<String> visualize(
            @RequestParam(defaultValue = "mermaid") String format,
            @RequestParam(defaultValue = "services") String section) {
        return ResponseEntity.ok(graphStore.generateVisualization(format, section));
    }

    @PostMapping("/save")
    @Operation(summary = "Save graph", description = "Writes the graph document to its configured location")
    public ResponseEntity<ApiResponse<GraphDescription>> save() {
        graphStore.save(Path.of(config.getStore().getPath()));
        return ResponseEntity.ok(ApiResponse.success(graphStore.describe(), "Graph saved"));
    }

    @PostMapping("/validate")
    @Operation(summary = "Validate graph", description = "Checks structural consistency of the document")
    public ResponseEntity<ApiResponse<GraphDescription>> validate() {
        graphStore.validate();
        return ResponseEntity.ok(ApiResponse.success(graphStore.describe(), "Graph is valid"));
    }

    // ==================== Services ====================

    @GetMapping("/services")
    @Operation(summary = "List services")
    public ResponseEntity<ApiResponse<List<String>>> listServices() {
        return ResponseEntity.ok(ApiResponse.success(graphStore.listServiceNames()));
    }

    @GetMapping("/services/{name}")
    @Operation(summary = "Get service", description = "Finds a service in any category")
    public ResponseEntity<ApiResponse<ObjectNode>> getService(@PathVariable String name) {
        return graphStore.getService(name)
                .map(info -> ResponseEntity.ok(ApiResponse.success(info)))
                .orElseThrow(() -> notFound("Service", name));
    }

    @PutMapping("/services/{category}/{name}")
    @Operation(summary = "Add service", description = "Upserts a service and increments the patch version")
    public ResponseEntity<ApiResponse<String>> addService(
            @PathVariable String category,
            @PathVariable String name,
            @RequestBody ObjectNode info) {
        graphStore.addService(category, name, info);
        return ResponseEntity.ok(ApiResponse.success(graphStore.getVersion(), "Service " + name + " stored"));
    }

    @DeleteMapping("/services/{name}")
    @Operation(summary = "Delete service")
    public ResponseEntity<Void> deleteService(@PathVariable String name) {
        if (!graphStore.deleteService(name)) {
            throw notFound("Service", name);
        }
        return ResponseEntity.noContent().build();
    }

    // ==================== Patterns ====================

    @GetMapping("/patterns")
    @Operation(summary = "List patterns")
    public ResponseEntity<ApiResponse<List<String>>> listPatterns() {
        return ResponseEntity.ok(ApiResponse.success(graphStore.listPatternNames()));
    }

    @GetMapping("/patterns/{name}")
    @Operation(summary = "Get pattern", description = "Finds a pattern in any category")
    public ResponseEntity<ApiResponse<ObjectNode>> getPattern(@PathVariable String name) {
        return graphStore.getPattern(name)
                .map(info -> ResponseEntity.ok(ApiResponse.success(info)))
                .orElseThrow(() -> notFound("Pattern", name));
    }

    @PutMapping("/patterns/{category}/{name}")
    @Operation(summary = "Add pattern")
    public ResponseEntity<ApiResponse<Void>> addPattern(
            @PathVariable String category,
            @PathVariable String name,
            @RequestBody ObjectNode info) {
        graphStore.addPattern(category, name, info);
        return ResponseEntity.ok(ApiResponse.success(null, "Pattern " + name + " stored"));
    }

    @DeleteMapping("/patterns/{name}")
    @Operation(summary = "Delete pattern")
    public ResponseEntity<Void> deletePattern(@PathVariable String name) {
        if (!graphStore.deletePattern(name)) {
            throw notFound("Pattern", name);
        }
        return ResponseEntity.noContent().build();
    }

    private static GraphStoreException notFound(String kind, String name) {
        return new GraphStoreException(kind + " not found: " + name, name, GraphStoreException.NOT_FOUND);
    }
}
