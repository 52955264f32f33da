package com.kg.core.service.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Map;

/**
 * Detached copy of the whole graph document.
 *
 * @param version     semantic version of the document
 * @param lastUpdated time of the last mutation or save
 * @param sections    section contents keyed by section, every section present
 */
public record GraphSnapshot(String version, Instant lastUpdated, Map<GraphSection, ObjectNode> sections) {

    public ObjectNode section(GraphSection section) {
        return sections.get(section);
    }
}
