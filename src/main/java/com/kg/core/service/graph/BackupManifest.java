package com.kg.core.service.graph;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Describes one backup file of the graph document.
 *
 * @param timestamp   when the backup was taken, at second resolution for listed files
 * @param version     document version held by the backup, null when unreadable
 * @param description free text given when the backup was taken, null for listed files
 * @param path        location of the backup file
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackupManifest(Instant timestamp, String version, String description, String path) {
}
