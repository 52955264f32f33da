package com.kg.core.service.graph;

import java.time.Instant;
import java.util.List;

/**
 * Summary of the loaded graph document.
 */
public record GraphDescription(
        String version,
        Instant lastUpdated,
        int serviceCount,
        int patternCount,
        List<String> serviceNames,
        List<String> patternNames,
        List<String> serviceCategories,
        List<String> patternCategories) {
}
