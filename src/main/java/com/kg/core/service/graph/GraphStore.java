package com.kg.core.service.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Versioned knowledge graph document with disk persistence, backup and restore.
 *
 * Every operation fails with {@link GraphStoreException#GRAPH_NOT_LOADED} until the
 * store has been loaded or initialized, and every mutation moves
 * {@link #getLastUpdated()} strictly forward. Values handed out are detached copies.
 */
public interface GraphStore {

    /**
     * Replaces the in-memory document with the one stored at the given path.
     *
     * @param path document location
     * @throws GraphStoreException with {@code IO_ERROR} or {@code PARSE_ERROR}
     */
    void load(Path path);

    /**
     * Resets the store to an empty document at version 1.0.0 and marks it loaded.
     */
    void initializeEmpty();

    /**
     * Stamps {@code last_updated} and writes the pretty-printed document.
     *
     * @param path target location, parent directories are created
     */
    void save(Path path);

    /**
     * Resolves a top-level node: {@code version}, {@code last_updated} or a section name.
     *
     * @param path top-level node name
     * @return text node for the scalars, copy of the section otherwise
     * @throws GraphStoreException {@code NOT_IMPLEMENTED} for any other path
     */
    JsonNode getNode(String path);

    /**
     * Replaces a whole top-level node after a type check.
     * {@code version} takes a string, {@code last_updated} an RFC 3339 string and a
     * section an object; {@code services} and {@code patterns} need object categories.
     *
     * @param path  top-level node name
     * @param value new content
     * @throws GraphStoreException {@code TYPE_MISMATCH} for a value of the wrong shape,
     *                             {@code NOT_IMPLEMENTED} for any other path
     */
    void updateNode(String path, JsonNode value);

    /**
     * Upserts a service under a category of the services section and bumps the patch version.
     */
    void addService(String category, String name, ObjectNode info);

    /**
     * Upserts a pattern under a category of the patterns section.
     */
    void addPattern(String category, String name, ObjectNode info);

    Optional<ObjectNode> getService(String name);

    boolean deleteService(String name);

    List<String> listServiceNames();

    Optional<ObjectNode> getPattern(String name);

    boolean deletePattern(String name);

    List<String> listPatternNames();

    /**
     * Writes the full document to a timestamp-named file in the backup directory.
     *
     * @param description free text recorded in the returned manifest
     * @return manifest of the written backup
     */
    BackupManifest backup(String description);

    /**
     * Lists backup files in the backup directory, oldest first.
     */
    List<BackupManifest> listBackups();

    /**
     * Loads a backup file and swaps every in-memory field in one step.
     *
     * @param path backup file
     */
    void restoreFromBackup(Path path);

    /**
     * Restores the newest backup and saves it as the current document.
     *
     * @param documentPath where the restored document is saved
     * @return manifest of the restored backup
     * @throws GraphStoreException {@code NOT_FOUND} when no backup exists
     */
    BackupManifest syncFromLatestBackup(Path documentPath);

    /**
     * Renders part of the graph. Only {@code ("mermaid", "services")} is supported.
     *
     * @throws GraphStoreException {@code NOT_IMPLEMENTED} for any other combination
     */
    String generateVisualization(String format, String section);

    GraphDescription describe();

    /**
     * Checks structural consistency of the document.
     *
     * @throws GraphStoreException {@code INVALID_GRAPH} describing the first violation
     */
    void validate();

    /**
     * Detached copy of the whole document.
     */
    GraphSnapshot snapshot();

    String getVersion();

    Instant getLastUpdated();

    boolean isLoaded();
}
