package com.kg.core.service.api.dto;

/**
 * Identifiers of a published update.
 *
 * @param updateId id carried by the update record
 * @param eventId  id assigned by the event bus
 */
public record PublishResponse(String updateId, String eventId) {
}
