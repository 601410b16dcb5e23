package com.itiac.cli;

import com.itiac.core.analysis.ImpactAnalysisEngine;
import com.itiac.core.config.ImpactConfig;
import com.itiac.core.model.InfrastructureSnapshot;
import com.itiac.core.model.StepImpact;
import com.itiac.core.model.WorkflowStep;
import com.itiac.core.workflow.StepView;
import com.itiac.core.workflow.WorkflowImpact;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Command to show business workflows affected by the current outage.
 *
 * <p>Workflows are listed most critical first. {@code --view} selects which steps are
 * printed: all of them, only impacted ones, or impacted ones with their neighbours.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * itiac workflows snapshot.json
 * itiac workflows snapshot.json --view all
 * }</pre>
 */
@Command(
    name = "workflows",
    description = "Show business workflows affected by offline components",
    mixinStandardHelpOptions = true
)
public class WorkflowsCommand extends SnapshotCommand {

    private static final Logger log = LoggerFactory.getLogger(WorkflowsCommand.class);

    @Option(
        names = {"--view"},
        description = "Steps to show: all, impacted or context (default: context)",
        defaultValue = "context"
    )
    private String view;

    @Override
    protected int execute(InfrastructureSnapshot snapshot, ImpactConfig config) {
        StepView stepView = parseView(view);
        if (stepView == null) {
            log.error("Unknown view: {}. Use: all, impacted or context", view);
            System.err.println("✗ Unknown view: " + view);
            return EXIT_FAILURE;
        }

        ImpactAnalysisEngine engine = new ImpactAnalysisEngine(config.scoringPolicy());
        List<WorkflowImpact> impacts = engine.mapWorkflowImpact(snapshot, null);
        log.info("{} workflow(s) affected", impacts.size());

        System.out.println("Affected workflows: " + impacts.size());
        if (impacts.isEmpty()) {
            System.out.println("  No workflows affected.");
            return EXIT_OK;
        }

        for (WorkflowImpact impact : impacts) {
            System.out.println();
            System.out.printf("  %s [%s]  %d of %d step(s) impacted%n",
                impact.workflow().name(),
                impact.workflow().criticality().value(),
                impact.impactedSteps().size(),
                impact.stepsInOrder().size());

            for (int index : impact.visibleStepIndices(stepView)) {
                WorkflowStep step = impact.stepsInOrder().get(index);
                StepImpact stepImpact = impact.impactAt(index);
                if (stepImpact == null) {
                    System.out.printf("    %d. %s  ok%n", step.order(), step.name());
                } else {
                    System.out.printf("    %d. %s  %s (%s)%n", step.order(), step.name(), stepImpact.severity(),
                        String.join(", ", stepImpact.reasonComponentIds()));
                }
            }
        }
        return EXIT_OK;
    }

    private static StepView parseView(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "all" -> StepView.ALL;
            case "impacted" -> StepView.IMPACTED_ONLY;
            case "context" -> StepView.IMPACTED_WITH_CONTEXT;
            default -> null;
        };
    }
}
