package com.kg.core.service.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.kg.core.service.api.dto.ApiResponse;
import com.kg.core.service.api.dto.PublishResponse;
import com.kg.core.service.api.dto.PublishUpdateRequest;
import com.kg.core.service.api.dto.ServiceRegistrationRequest;
import com.kg.core.service.lifecycle.KnowledgeGraphCoordinator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller publishing updates into the ingestion pipeline.
 * Updates are committed asynchronously, so every endpoint answers 202 Accepted.
 */
@Slf4j
@RestController
@RequestMapping("/updates")
@Tag(name = "Updates", description = "Publish knowledge graph updates to the event bus")
@RequiredArgsConstructor
public class UpdateController {

    private final KnowledgeGraphCoordinator coordinator;

    @PostMapping
    @Operation(summary = "Publish update", description = "Validates an update and publishes it to the event bus")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Update published"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid update"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Event bus refused the update"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "503", description = "Service degraded")
    })
    public ResponseEntity<ApiResponse<PublishResponse>> publish(@Valid @RequestBody PublishUpdateRequest request) {
        log.debug("Publishing update {} for {}", request.getId(), request.getServiceId());
        String eventId = coordinator.publishUpdate(request.toRecord());
        return accepted(new PublishResponse(request.getId(), eventId));
    }

    @PostMapping("/services/{serviceId}/registration")
    @Operation(summary = "Register service", description = "Publishes a service registration update")
    public ResponseEntity<ApiResponse<PublishResponse>> registerService(
            @PathVariable String serviceId,
            @RequestBody ServiceRegistrationRequest request) {
        String eventId = coordinator.registerService(serviceId, request.getCapabilities(), request.getSchema());
        return accepted(new PublishResponse(null, eventId));
    }

    @PutMapping("/services/{serviceId}/schema")
    @Operation(summary = "Update schema", description = "Publishes a schema update")
    public ResponseEntity<ApiResponse<PublishResponse>> updateSchema(
            @PathVariable String serviceId,
            @RequestBody JsonNode schema) {
        String eventId = coordinator.updateSchema(serviceId, schema);
        return accepted(new PublishResponse(null, eventId));
    }

    @PostMapping("/services/{serviceId}/relations")
    @Operation(summary = "Update relation", description = "Publishes a relation update, then saves and backs up the graph")
    public ResponseEntity<ApiResponse<PublishResponse>> updateRelation(
            @PathVariable String serviceId,
            @RequestBody JsonNode relation) {
        String eventId = coordinator.updateRelation(serviceId, relation);
        return accepted(new PublishResponse(null, eventId));
    }

    private ResponseEntity<ApiResponse<PublishResponse>> accepted(PublishResponse response) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(response, "Update published"));
    }
}
