package com.itiac.cli;

import com.itiac.core.config.ConfigLoader;
import com.itiac.core.config.ImpactConfig;
import com.itiac.core.model.InfrastructureSnapshot;
import com.itiac.core.snapshot.FileSnapshotSource;
import com.itiac.core.snapshot.SnapshotValidationException;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Base class for commands that work on a snapshot file.
 *
 * <p>Loads the snapshot and the configuration, turns loading failures into exit code
 * {@link #EXIT_FAILURE}, and hands the snapshot to {@link #execute}.
 */
public abstract class SnapshotCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCommand.class);

    /** Command completed */
    public static final int EXIT_OK = 0;

    /** Snapshot or arguments could not be used */
    public static final int EXIT_FAILURE = 1;

    /** Snapshot was read but has validation errors */
    public static final int EXIT_INVALID = 2;

    @Parameters(index = "0", description = "Snapshot file (.json, .yaml or .yml)")
    protected Path snapshotFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: itiac.yaml)"
    )
    protected Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Override
    public Integer call() {
        InfrastructureSnapshot snapshot;
        try {
            snapshot = new FileSnapshotSource(snapshotFile).load();
        } catch (UncheckedIOException e) {
            log.error("Cannot read snapshot {}", snapshotFile, e);
            System.err.println("✗ Cannot read snapshot: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (SnapshotValidationException e) {
            log.error("Snapshot {} is incomplete: {}", snapshotFile, e.getMessage());
            System.err.println("✗ Snapshot is incomplete:");
            e.violations().forEach(v -> System.err.println("    - " + v));
            return EXIT_FAILURE;
        }

        return execute(snapshot, ConfigLoader.load(configPath));
    }

    /**
     * Runs the command.
     *
     * @param snapshot loaded snapshot
     * @param config loaded configuration, or defaults
     * @return exit code
     */
    protected abstract int execute(InfrastructureSnapshot snapshot, ImpactConfig config);

    /**
     * Formats a component as {@code Name (id)}.
     *
     * @param snapshot snapshot to look the name up in
     * @param componentId component id
     * @return display label
     */
    protected static String label(InfrastructureSnapshot snapshot, String componentId) {
        return snapshot.nameOf(componentId) + " (" + componentId + ")";
    }
}
