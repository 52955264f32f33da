package com.kg.core.service.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Graph store keeping the document in memory and persisting it as JSON on disk.
 *
 * A single read/write lock guards every field. {@link #save(Path)} holds only the
 * read lock while it stamps {@code last_updated}, so a save racing a mutation may
 * record either timestamp.
 */
@Slf4j
public class FileBackedGraphStore implements GraphStore {

    static final String INITIAL_VERSION = "1.0.0";
    static final String MERMAID_FORMAT = "mermaid";
    static final String CORE_SERVICES = "core_services";
    static final String DEPENDENCIES_FIELD = "dependencies";
    static final String VERSION_NODE = "version";
    static final String LAST_UPDATED_NODE = "last_updated";

    private static final DateTimeFormatter BACKUP_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final Pattern BACKUP_FILE = Pattern.compile("knowledge_graph_(\\d{8}_\\d{6})\\.json");
    private static final Pattern SEMVER = Pattern.compile("(\\d+)\\.(\\d+)\\.(\\d+)");

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final GraphDocumentCodec codec;
    private final Clock clock;
    private final Path backupDirectory;

    private final Map<GraphSection, ObjectNode> sections = new EnumMap<>(GraphSection.class);
    private String version;
    private volatile Instant lastUpdated;
    private boolean loaded;

    public FileBackedGraphStore(GraphDocumentCodec codec, Clock clock, Path backupDirectory) {
        this.codec = codec;
        this.clock = clock;
        this.backupDirectory = backupDirectory;
    }

    /**
     * Loads the document at the given path when it exists, otherwise starts empty.
     * An unreadable document is logged and replaced by an empty one.
     */
    public void openOrInitialize(Path path) {
        if (!Files.exists(path)) {
            log.info("No knowledge graph at {}, initializing empty graph", path);
            initializeEmpty();
            return;
        }
        try {
            load(path);
        } catch (GraphStoreException e) {
            log.warn("Failed to load knowledge graph from {}, initializing empty graph: {}", path, e.getMessage());
            initializeEmpty();
        }
    }

    // ==================== Persistence ====================

    @Override
    public void load(Path path) {
        var snapshot = readDocument(path);
        lock.writeLock().lock();
        try {
            apply(snapshot);
            loaded = true;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Knowledge graph loaded from {}, version {}", path, snapshot.version());
    }

    @Override
    public void initializeEmpty() {
        lock.writeLock().lock();
        try {
            sections.clear();
            for (GraphSection section : GraphSection.values()) {
                sections.put(section, JsonNodeFactory.instance.objectNode());
            }
            version = INITIAL_VERSION;
            lastUpdated = nextTimestamp();
            loaded = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void save(Path path) {
        byte[] content;
        lock.readLock().lock();
        try {
            requireLoaded();
            lastUpdated = nextTimestamp();
            content = codec.encode(copyState());
        } finally {
            lock.readLock().unlock();
        }
        writeFile(path, content);
        log.debug("Knowledge graph saved to {}", path);
    }

    // ==================== Nodes ====================

    @Override
    public JsonNode getNode(String path) {
        return read(() -> readNode(path));
    }

    private JsonNode readNode(String path) {
        requireTopLevel(path);
        if (VERSION_NODE.equals(path)) {
            return TextNode.valueOf(version);
        }
        if (LAST_UPDATED_NODE.equals(path)) {
            return TextNode.valueOf(lastUpdated.toString());
        }
        return sections.get(resolveSection(path)).deepCopy();
    }

    @Override
    public void updateNode(String path, JsonNode value) {
        if (LAST_UPDATED_NODE.equals(path)) {
            // the given timestamp replaces the automatic stamp
            write(() -> lastUpdated = parseLastUpdated(value), false);
            return;
        }
        write(() -> {
            requireTopLevel(path);
            if (VERSION_NODE.equals(path)) {
                if (value == null || !value.isTextual()) {
                    throw typeMismatch(path, "a string", value);
                }
                version = value.asText();
                return;
            }
            var section = resolveSection(path);
            if (value == null || !value.isObject()) {
                throw typeMismatch(path, "a JSON object", value);
            }
            if (section == GraphSection.SERVICES || section == GraphSection.PATTERNS) {
                var categories = value.fields();
                while (categories.hasNext()) {
                    var category = categories.next();
                    if (!category.getValue().isObject()) {
                        throw typeMismatch(path + "." + category.getKey(), "a JSON object", category.getValue());
                    }
                }
            }
            sections.put(section, ((ObjectNode) value).deepCopy());
        });
    }

    private Instant parseLastUpdated(JsonNode value) {
        if (value == null || !value.isTextual()) {
            throw typeMismatch(LAST_UPDATED_NODE, "an RFC 3339 string", value);
        }
        try {
            return OffsetDateTime.parse(value.asText()).toInstant();
        } catch (DateTimeParseException e) {
            throw new GraphStoreException("Node last_updated requires an RFC 3339 timestamp, got " + value.asText(),
                    LAST_UPDATED_NODE, GraphStoreException.TYPE_MISMATCH, e);
        }
    }

    private static GraphStoreException typeMismatch(String path, String expected, JsonNode value) {
        return new GraphStoreException("Node " + path + " requires " + expected + ", got "
                + (value == null ? "null" : value.getNodeType()), path, GraphStoreException.TYPE_MISMATCH);
    }

    private static void requireTopLevel(String path) {
        if (path == null || path.isBlank() || path.contains(".")) {
            throw new GraphStoreException("Only top-level node paths are supported: " + path, path,
                    GraphStoreException.NOT_IMPLEMENTED);
        }
    }

    private GraphSection resolveSection(String path) {
        return GraphSection.fromKey(path)
                .orElseThrow(() -> new GraphStoreException("Unsupported node path: " + path, path,
                        GraphStoreException.NOT_IMPLEMENTED));
    }

    // ==================== Services and patterns ====================

    @Override
    public void addService(String category, String name, ObjectNode info) {
        write(() -> {
            upsert(GraphSection.SERVICES, category, name, info);
            version = incrementPatch(version);
        });
        log.info("Service {} added under {}", name, category);
    }

    @Override
    public void addPattern(String category, String name, ObjectNode info) {
        write(() -> upsert(GraphSection.PATTERNS, category, name, info));
        log.info("Pattern {} added under {}", name, category);
    }

    @Override
    public Optional<ObjectNode> getService(String name) {
        return read(() -> findEntry(GraphSection.SERVICES, name).map(ObjectNode::deepCopy));
    }

    @Override
    public boolean deleteService(String name) {
        return removeEntry(GraphSection.SERVICES, name);
    }

    @Override
    public List<String> listServiceNames() {
        return read(() -> entryNames(GraphSection.SERVICES));
    }

    @Override
    public Optional<ObjectNode> getPattern(String name) {
        return read(() -> findEntry(GraphSection.PATTERNS, name).map(ObjectNode::deepCopy));
    }

    @Override
    public boolean deletePattern(String name) {
        return removeEntry(GraphSection.PATTERNS, name);
    }

    @Override
    public List<String> listPatternNames() {
        return read(() -> entryNames(GraphSection.PATTERNS));
    }

    private void upsert(GraphSection section, String category, String name, ObjectNode info) {
        var content = sections.get(section);
        JsonNode bucket = content.get(category);
        if (bucket == null || !bucket.isObject()) {
            bucket = content.putObject(category);
        }
        ((ObjectNode) bucket).set(name, info == null ? JsonNodeFactory.instance.objectNode() : info.deepCopy());
    }

    private Optional<ObjectNode> findEntry(GraphSection section, String name) {
        for (JsonNode bucket : sections.get(section)) {
            JsonNode entry = bucket.get(name);
            if (bucket.isObject() && entry != null && entry.isObject()) {
                return Optional.of((ObjectNode) entry);
            }
        }
        return Optional.empty();
    }

    private boolean removeEntry(GraphSection section, String name) {
        lock.writeLock().lock();
        try {
            requireLoaded();
            boolean removed = false;
            for (JsonNode bucket : sections.get(section)) {
                if (bucket.isObject() && ((ObjectNode) bucket).remove(name) != null) {
                    removed = true;
                }
            }
            if (removed) {
                lastUpdated = nextTimestamp();
                log.info("Removed {} from {}", name, section.getKey());
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<String> entryNames(GraphSection section) {
        List<String> names = new ArrayList<>();
        for (JsonNode bucket : sections.get(section)) {
            if (bucket.isObject()) {
                bucket.fieldNames().forEachRemaining(names::add);
            }
        }
        return names;
    }

    // ==================== Backups ====================

    @Override
    public BackupManifest backup(String description) {
        var timestamp = clock.instant();
        var path = backupDirectory.resolve("knowledge_graph_" + BACKUP_STAMP.format(timestamp) + ".json");
        GraphSnapshot snapshot = read(this::copyState);
        writeFile(path, codec.encode(snapshot));
        log.info("Knowledge graph backed up to {} ({})", path, description);
        return new BackupManifest(timestamp, snapshot.version(), description, path.toString());
    }

    @Override
    public List<BackupManifest> listBackups() {
        if (!isLoaded()) {
            throw GraphStoreException.notLoaded();
        }
        try {
            Files.createDirectories(backupDirectory);
        } catch (IOException e) {
            throw new GraphStoreException("Failed to create backup directory", backupDirectory.toString(),
                    GraphStoreException.IO_ERROR, e);
        }
        List<BackupManifest> manifests = new ArrayList<>();
        try (Stream<Path> files = Files.list(backupDirectory)) {
            files.filter(Files::isRegularFile).forEach(file -> toManifest(file).ifPresent(manifests::add));
        } catch (IOException e) {
            throw new GraphStoreException("Failed to list backups", backupDirectory.toString(),
                    GraphStoreException.IO_ERROR, e);
        }
        manifests.sort(Comparator.comparing(BackupManifest::timestamp));
        return manifests;
    }

    private Optional<BackupManifest> toManifest(Path file) {
        Matcher matcher = BACKUP_FILE.matcher(file.getFileName().toString());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Instant timestamp;
        try {
            timestamp = LocalDateTime.parse(matcher.group(1), DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"))
                    .toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Skipping backup with malformed name {}", file);
            return Optional.empty();
        }
        String backupVersion = null;
        try {
            backupVersion = codec.decode(Files.readAllBytes(file), file.toString()).version();
        } catch (IOException | GraphStoreException e) {
            log.warn("Backup {} is unreadable: {}", file, e.getMessage());
        }
        return Optional.of(new BackupManifest(timestamp, backupVersion, null, file.toString()));
    }

    @Override
    public void restoreFromBackup(Path path) {
        var snapshot = readDocument(path);
        lock.writeLock().lock();
        try {
            apply(snapshot);
            loaded = true;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Knowledge graph restored from {}, version {}", path, snapshot.version());
    }

    @Override
    public BackupManifest syncFromLatestBackup(Path documentPath) {
        var latest = listBackups().stream()
                .max(Comparator.comparing(BackupManifest::timestamp))
                .orElseThrow(() -> new GraphStoreException("No backups found in " + backupDirectory,
                        backupDirectory.toString(), GraphStoreException.NOT_FOUND));
        restoreFromBackup(Path.of(latest.path()));
        save(documentPath);
        return latest;
    }

    // ==================== Inspection ====================

    @Override
    public String generateVisualization(String format, String section) {
        if (!MERMAID_FORMAT.equals(format) || !GraphSection.SERVICES.getKey().equals(section)) {
            throw new GraphStoreException("Visualization not supported for format " + format
                    + " and section " + section, section, GraphStoreException.NOT_IMPLEMENTED);
        }
        return read(() -> renderServiceGraph(sections.get(GraphSection.SERVICES).get(CORE_SERVICES)));
    }

    private String renderServiceGraph(JsonNode services) {
        var out = new StringBuilder("graph TD\n");
        if (services == null || !services.isObject()) {
            return out.toString();
        }
        Iterator<String> names = services.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            out.append("    service_").append(name).append('[').append(quote(name)).append("]\n");
        }
        Iterator<Map.Entry<String, JsonNode>> entries = services.fields();
        while (entries.hasNext()) {
            var entry = entries.next();
            for (JsonNode dependency : entry.getValue().path(DEPENDENCIES_FIELD)) {
                String target = dependency.asText();
                String targetId = "service_" + target;
                if (!services.has(target)) {
                    targetId = target;
                    out.append("    ").append(targetId).append('[').append(quote(target)).append("]\n");
                }
                out.append("    service_").append(entry.getKey()).append(" --> ").append(targetId).append('\n');
            }
        }
        return out.toString();
    }

    private static String quote(String label) {
        return '"' + label.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    @Override
    public GraphDescription describe() {
        return read(() -> new GraphDescription(
                version,
                lastUpdated,
                entryNames(GraphSection.SERVICES).size(),
                entryNames(GraphSection.PATTERNS).size(),
                entryNames(GraphSection.SERVICES),
                entryNames(GraphSection.PATTERNS),
                categories(GraphSection.SERVICES),
                categories(GraphSection.PATTERNS)));
    }

    private List<String> categories(GraphSection section) {
        List<String> names = new ArrayList<>();
        sections.get(section).fieldNames().forEachRemaining(names::add);
        return names;
    }

    @Override
    public void validate() {
        read(() -> {
            if (version == null || version.isBlank()) {
                throw invalid("Graph version is required");
            }
            if (lastUpdated == null) {
                throw invalid("Graph last_updated is required");
            }
            var services = sections.get(GraphSection.SERVICES).fields();
            while (services.hasNext()) {
                var category = services.next();
                if (!category.getValue().isObject()) {
                    throw invalid("Service category " + category.getKey() + " must be an object");
                }
                var entries = category.getValue().fields();
                while (entries.hasNext()) {
                    var service = entries.next();
                    if (service.getKey().isBlank()) {
                        throw invalid("Service name must not be empty in " + category.getKey());
                    }
                    for (JsonNode dependency : service.getValue().path(DEPENDENCIES_FIELD)) {
                        if (service.getKey().equals(dependency.asText())) {
                            throw invalid("Service " + service.getKey() + " depends on itself");
                        }
                    }
                }
            }
            return null;
        });
    }

    private static GraphStoreException invalid(String message) {
        return new GraphStoreException(message, null, GraphStoreException.INVALID_GRAPH);
    }

    @Override
    public GraphSnapshot snapshot() {
        return read(this::copyState);
    }

    @Override
    public String getVersion() {
        return read(() -> version);
    }

    @Override
    public Instant getLastUpdated() {
        return read(() -> lastUpdated);
    }

    @Override
    public boolean isLoaded() {
        lock.readLock().lock();
        try {
            return loaded;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ==================== Helpers ====================

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            requireLoaded();
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private void write(Runnable action) {
        write(action, true);
    }

    private void write(Runnable action, boolean stamp) {
        lock.writeLock().lock();
        try {
            requireLoaded();
            action.run();
            if (stamp) {
                lastUpdated = nextTimestamp();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void requireLoaded() {
        if (!loaded) {
            throw GraphStoreException.notLoaded();
        }
    }

    private Instant nextTimestamp() {
        Instant now = clock.instant();
        Instant previous = lastUpdated;
        if (previous != null && !now.isAfter(previous)) {
            return previous.plus(1, ChronoUnit.MICROS);
        }
        return now;
    }

    private GraphSnapshot copyState() {
        Map<GraphSection, ObjectNode> copy = new EnumMap<>(GraphSection.class);
        sections.forEach((section, content) -> copy.put(section, content.deepCopy()));
        return new GraphSnapshot(version, lastUpdated, copy);
    }

    private void apply(GraphSnapshot snapshot) {
        sections.clear();
        sections.putAll(snapshot.sections());
        version = snapshot.version();
        lastUpdated = snapshot.lastUpdated();
    }

    private GraphSnapshot readDocument(Path path) {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new GraphStoreException("Failed to read knowledge graph from " + path, path.toString(),
                    GraphStoreException.IO_ERROR, e);
        }
        return codec.decode(content, path.toString());
    }

    private static void writeFile(Path path, byte[] content) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, content);
        } catch (IOException e) {
            throw new GraphStoreException("Failed to write " + path, path.toString(), GraphStoreException.IO_ERROR, e);
        }
    }

    static String incrementPatch(String current) {
        Matcher matcher = current == null ? null : SEMVER.matcher(current);
        if (matcher == null || !matcher.matches()) {
            return INITIAL_VERSION;
        }
        long patch = Long.parseLong(matcher.group(3)) + 1;
        return matcher.group(1) + "." + matcher.group(2) + "." + patch;
    }
}
