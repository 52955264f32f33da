package com.kg.core.service.bus;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Message exchanged on the event bus.
 *
 * @param id        event identifier, the update id for knowledge graph updates
 * @param type      event type, also the topic it is published to
 * @param timestamp unix seconds
 * @param payload   event body
 */
public record EventEnvelope(String id, String type, long timestamp, JsonNode payload) {
}
