package com.kg.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.kg.core.service.ingest.UpdateRecord;
import com.kg.core.service.ingest.UpdateType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request body for publishing a knowledge graph update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishUpdateRequest {

    @NotBlank(message = "id is required")
    private String id;

    @NotNull(message = "type is required")
    private UpdateType type;

    @NotBlank(message = "service_id is required")
    @JsonProperty("service_id")
    private String serviceId;

    private JsonNode payload;

    /**
     * Defaults to the publish time when absent.
     */
    private Instant timestamp;

    private String version;

    public UpdateRecord toRecord() {
        return new UpdateRecord(id, type, serviceId, payload, timestamp, version);
    }
}
