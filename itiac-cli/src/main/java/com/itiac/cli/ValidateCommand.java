package com.itiac.cli;

import com.itiac.core.config.ImpactConfig;
import com.itiac.core.model.InfrastructureSnapshot;
import com.itiac.core.validation.DependencyValidator;
import com.itiac.core.validation.SnapshotValidator;
import com.itiac.core.validation.ValidationResult;
import picocli.CommandLine.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Command to check a snapshot for structural problems.
 *
 * <p>Reports dangling and duplicate references, self-loops, dependency cycles, single
 * points of failure and implausible dependency types. Exits with
 * {@link SnapshotCommand#EXIT_INVALID} when errors are found.
 */
@Command(
    name = "validate",
    description = "Validate a snapshot",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends SnapshotCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Override
    protected int execute(InfrastructureSnapshot snapshot, ImpactConfig config) {
        log.info("Validating snapshot: {}", snapshotFile);

        ValidationResult result = SnapshotValidator.inspect(snapshot);
        List<List<String>> cycles = DependencyValidator.detectAllCycles(snapshot.dependencies());
        List<String> spofs = DependencyValidator.singlePointsOfFailure(
            snapshot.dependencies(), config.singlePointOfFailureThreshold());

        System.out.println("Errors: " + result.errors().size());
        result.errors().forEach(e -> System.out.println("  ✗ " + e));
        System.out.println("Warnings: " + result.warnings().size());
        result.warnings().forEach(w -> System.out.println("  ⚠ " + w));

        System.out.println("Cycles: " + cycles.size());
        cycles.forEach(cycle -> System.out.println("  ↻ " + String.join(" -> ", cycle)));
        System.out.println("Single points of failure: " + spofs.size());
        spofs.forEach(id -> System.out.println("  • " + label(snapshot, id)));

        System.out.println();
        if (!result.isValid()) {
            System.out.println("✗ Snapshot is invalid");
            return EXIT_INVALID;
        }
        System.out.println("✓ Snapshot is valid");
        return EXIT_OK;
    }
}
