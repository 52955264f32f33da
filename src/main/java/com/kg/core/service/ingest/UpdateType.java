package com.kg.core.service.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Kind of change carried by an update record.
 */
public enum UpdateType {

    @JsonProperty("service_registration")
    SERVICE_REGISTRATION,

    @JsonProperty("schema_update")
    SCHEMA_UPDATE,

    @JsonProperty("pattern_detection")
    PATTERN_DETECTION,

    @JsonProperty("relation_update")
    RELATION_UPDATE
}
