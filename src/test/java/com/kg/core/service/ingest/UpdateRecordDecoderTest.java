package com.kg.core.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kg.core.service.bus.EventEnvelope;
import com.kg.core.service.support.TestObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpdateRecordDecoderTest {

    private final ObjectMapper objectMapper = TestObjects.objectMapper();
    private final UpdateRecordDecoder decoder = new UpdateRecordDecoder(objectMapper);

    private EventEnvelope envelope(String payload) throws Exception {
        return new EventEnvelope("evt-1", "knowledge_graph.update", 0, objectMapper.readTree(payload));
    }

    @Test
    @DisplayName("Decodes the wire form of an update")
    void decodesUpdate() throws Exception {
        UpdateRecord record = decoder.decode(envelope("""
                {"id":"reg_user_1","type":"service_registration","service_id":"user",
                 "payload":{"capabilities":["login"]},"timestamp":"2025-04-30T05:16:19Z","version":"1.0",
                 "extra":"ignored"}
                """));

        assertThat(record.id()).isEqualTo("reg_user_1");
        assertThat(record.type()).isEqualTo(UpdateType.SERVICE_REGISTRATION);
        assertThat(record.serviceId()).isEqualTo("user");
        assertThat(record.payload().get("capabilities").get(0).asText()).isEqualTo("login");
        assertThat(record.timestamp()).isEqualTo(Instant.parse("2025-04-30T05:16:19Z"));
    }

    @Test
    @DisplayName("Unknown types, missing types and non-object payloads are decode errors")
    void rejectsMalformedPayloads() throws Exception {
        assertThatThrownBy(() -> decoder.decode(envelope("{\"id\":\"x\",\"type\":\"teleport\"}")))
                .extracting("errorCode").isEqualTo(IngestionException.DECODE_ERROR);
        assertThatThrownBy(() -> decoder.decode(envelope("{\"id\":\"x\",\"service_id\":\"s\"}")))
                .extracting("errorCode").isEqualTo(IngestionException.DECODE_ERROR);
        assertThatThrownBy(() -> decoder.decode(envelope("\"just text\"")))
                .extracting("errorCode").isEqualTo(IngestionException.DECODE_ERROR);
    }
}
