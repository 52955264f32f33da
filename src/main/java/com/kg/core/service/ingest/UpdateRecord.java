package com.kg.core.service.ingest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A change to the knowledge graph travelling through the ingestion pipeline.
 *
 * The id doubles as the deduplication token for processed-update markers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateRecord(
        @JsonProperty("id") String id,
        @JsonProperty("type") UpdateType type,
        @JsonProperty("service_id") String serviceId,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("version") String version) {

    public UpdateRecord withTimestamp(Instant newTimestamp) {
        return new UpdateRecord(id, type, serviceId, payload, newTimestamp, version);
    }
}
