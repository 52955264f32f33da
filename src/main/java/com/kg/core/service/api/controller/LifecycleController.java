package com.kg.core.service.api.controller;

import com.kg.core.service.api.dto.ApiResponse;
import com.kg.core.service.api.dto.LifecycleStatusResponse;
import com.kg.core.service.ingest.BatchCommitter;
import com.kg.core.service.ingest.EventSubscriber;
import com.kg.core.service.ingest.UpdateBuffer;
import com.kg.core.service.lifecycle.KnowledgeGraphCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/lifecycle")
@Tag(name = "Lifecycle", description = "Coordinator state and degraded-mode recovery")
@RequiredArgsConstructor
public class LifecycleController {

    private final KnowledgeGraphCoordinator coordinator;
    private final EventSubscriber subscriber;
    private final BatchCommitter committer;
    private final UpdateBuffer buffer;

    @GetMapping
    @Operation(summary = "Get lifecycle status")
    public ResponseEntity<ApiResponse<LifecycleStatusResponse>> status() {
        return ResponseEntity.ok(ApiResponse.success(currentStatus()));
    }

    @PostMapping("/recover")
    @Operation(summary = "Recover from degraded mode",
               description = "Re-checks the durable cache and restarts the ingestion pipeline")
    public ResponseEntity<ApiResponse<LifecycleStatusResponse>> recover() {
        var state = coordinator.recover();
        log.info("Recovery request completed, state={}", state);
        return ResponseEntity.ok(ApiResponse.success(currentStatus(), "Coordinator " + state));
    }

    private LifecycleStatusResponse currentStatus() {
        return LifecycleStatusResponse.builder()
                .state(coordinator.getState())
                .degraded(coordinator.isDegraded())
                .subscriberState(subscriber.getState())
                .reconnectAttempts(subscriber.getReconnectAttempts())
                .committerState(committer.getState())
                .pendingUpdates(committer.getPendingCount())
                .bufferSize(buffer.size())
                .bufferCapacity(buffer.getCapacity())
                .build();
    }
}
