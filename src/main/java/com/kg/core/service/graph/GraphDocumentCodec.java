package com.kg.core.service.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Converts between the in-memory graph and its pretty-printed JSON document.
 *
 * The document carries {@code version}, an RFC 3339 {@code last_updated} and one
 * object per {@link GraphSection}. Missing sections decode as empty objects.
 */
public class GraphDocumentCodec {

    static final String VERSION_FIELD = "version";
    static final String LAST_UPDATED_FIELD = "last_updated";

    private final ObjectMapper objectMapper;

    public GraphDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(GraphSnapshot snapshot) {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put(VERSION_FIELD, snapshot.version());
        root.put(LAST_UPDATED_FIELD, snapshot.lastUpdated() != null ? snapshot.lastUpdated().toString() : null);
        for (GraphSection section : GraphSection.values()) {
            ObjectNode content = snapshot.section(section);
            root.set(section.getKey(), content != null ? content : JsonNodeFactory.instance.objectNode());
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new GraphStoreException("Failed to encode knowledge graph", null,
                    GraphStoreException.ENCODE_ERROR, e);
        }
    }

    public GraphSnapshot decode(byte[] content, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (IOException e) {
            throw new GraphStoreException("Failed to parse knowledge graph: " + e.getMessage(),
                    source, GraphStoreException.PARSE_ERROR, e);
        }
        if (root == null || !root.isObject()) {
            throw new GraphStoreException("Knowledge graph document must be a JSON object", source,
                    GraphStoreException.PARSE_ERROR);
        }

        String version = root.hasNonNull(VERSION_FIELD) ? root.get(VERSION_FIELD).asText() : null;
        Instant lastUpdated = parseTimestamp(root.get(LAST_UPDATED_FIELD), source);

        Map<GraphSection, ObjectNode> sections = new EnumMap<>(GraphSection.class);
        for (GraphSection section : GraphSection.values()) {
            JsonNode node = root.get(section.getKey());
            if (node == null || node.isNull()) {
                sections.put(section, JsonNodeFactory.instance.objectNode());
            } else if (node.isObject()) {
                sections.put(section, (ObjectNode) node);
            } else {
                throw new GraphStoreException("Section " + section.getKey() + " must be a JSON object", source,
                        GraphStoreException.PARSE_ERROR);
            }
        }
        return new GraphSnapshot(version, lastUpdated, sections);
    }

    private Instant parseTimestamp(JsonNode node, String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(node.asText()).toInstant();
        } catch (DateTimeParseException e) {
            throw new GraphStoreException("Invalid last_updated timestamp: " + node.asText(), source,
                    GraphStoreException.PARSE_ERROR, e);
        }
    }
}
