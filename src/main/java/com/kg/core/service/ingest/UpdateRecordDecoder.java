package com.kg.core.service.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kg.core.service.bus.EventEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns event envelopes into update records.
 */
@Component
@RequiredArgsConstructor
public class UpdateRecordDecoder {

    private final ObjectMapper objectMapper;

    /**
     * @throws IngestionException with {@code DECODE_ERROR} when the payload is not an update record
     */
    public UpdateRecord decode(EventEnvelope envelope) {
        if (envelope.payload() == null || !envelope.payload().isObject()) {
            throw new IngestionException("Event payload is not an object", envelope.id(),
                    IngestionException.DECODE_ERROR);
        }
        UpdateRecord record;
        try {
            record = objectMapper.treeToValue(envelope.payload(), UpdateRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IngestionException("Failed to decode update: " + e.getMessage(), envelope.id(),
                    IngestionException.DECODE_ERROR, e);
        }
        if (record.type() == null) {
            throw new IngestionException("Update has no type", record.id(), IngestionException.DECODE_ERROR);
        }
        return record;
    }
}
