package com.itiac.core.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.itiac.core.model.InfrastructureSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads a snapshot exported as JSON ({@code .json}) or YAML ({@code .yaml}, {@code .yml}).
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "components": [
 *     {"id": "db-1", "name": "Orders DB", "type": "database", "status": "offline", "criticality": "high"}
 *   ],
 *   "dependencies": [
 *     {"id": "d1", "sourceId": "db-1", "targetId": "api-1", "type": "requires"}
 *   ],
 *   "workflows": [
 *     {"id": "wf-1", "name": "Checkout", "criticality": "critical",
 *      "steps": [{"id": "s1", "name": "Place order", "order": 1, "primaryComponentIds": ["api-1"]}]}
 *   ]
 * }
 * }</pre>
 */
public class FileSnapshotSource implements SnapshotSource {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotSource.class);

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Path path;
    private final SnapshotConverter converter;

    public FileSnapshotSource(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.converter = new SnapshotConverter();
    }

    public Path path() {
        return path;
    }

    /**
     * Reads and converts the file.
     *
     * @return snapshot
     * @throws UncheckedIOException if the file cannot be read or parsed
     * @throws SnapshotValidationException if required fields are missing
     */
    @Override
    public InfrastructureSnapshot load() {
        log.debug("Reading snapshot from: {}", path);
        SnapshotDocument document;
        try {
            document = mapperFor(path).readValue(path.toFile(), SnapshotDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot " + path + ": " + e.getMessage(), e);
        }

        InfrastructureSnapshot snapshot = converter.convert(document);
        log.info("Loaded snapshot from {}: {} components, {} dependencies, {} workflows",
            path, snapshot.components().size(), snapshot.dependencies().size(), snapshot.workflows().size());
        return snapshot;
    }

    private static ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML_MAPPER : JSON_MAPPER;
    }
}
