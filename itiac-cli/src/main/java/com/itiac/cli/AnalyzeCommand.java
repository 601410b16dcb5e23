package com.itiac.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.itiac.core.analysis.AnalysisScope;
import com.itiac.core.analysis.ImpactAnalysisEngine;
import com.itiac.core.config.ImpactConfig;
import com.itiac.core.model.AnalysisResult;
import com.itiac.core.model.InfrastructureSnapshot;
import com.itiac.core.model.StepImpact;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Command to score the business impact of components.
 *
 * <p>For every selected component, reports what sits downstream of it, which workflows
 * run on the affected components, a business impact score and a risk level. Without
 * {@code --component} or {@code --all}, the scope configured in {@code itiac.yaml} is used
 * (components that are not online, by default).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Components that are not online
 * itiac analyze snapshot.json
 *
 * # Every component, custom scoring
 * itiac analyze snapshot.json --all -c scoring.yaml
 *
 * # One component as JSON
 * itiac analyze snapshot.json --component db-orders --json
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Score the business impact of components",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand extends SnapshotCommand {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @Option(names = {"--component"}, description = "Analyze a single component by id")
    private String componentId;

    @Option(names = {"--all"}, description = "Analyze every component")
    private boolean all;

    @Option(names = {"--json"}, description = "Print results as JSON")
    private boolean json;

    @Override
    protected int execute(InfrastructureSnapshot snapshot, ImpactConfig config) {
        if (componentId != null && all) {
            log.error("--component and --all cannot be combined");
            System.err.println("✗ Use either --component or --all, not both");
            return EXIT_FAILURE;
        }

        AnalysisScope scope;
        if (componentId != null) {
            scope = AnalysisScope.single(componentId);
        } else if (all) {
            scope = AnalysisScope.allComponents();
        } else {
            scope = config.defaultScope();
        }

        ImpactAnalysisEngine engine = new ImpactAnalysisEngine(config.scoringPolicy());
        List<AnalysisResult> results = engine.computeAnalysisResults(snapshot, scope);
        log.info("Analyzed {} component(s)", results.size());

        if (json) {
            return printJson(results);
        }
        printResults(results);
        return EXIT_OK;
    }

    private int printJson(List<AnalysisResult> results) {
        try {
            System.out.println(JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(results));
            return EXIT_OK;
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize analysis results", e);
            System.err.println("✗ Failed to write JSON: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void printResults(List<AnalysisResult> results) {
        System.out.println("Impact analysis: " + results.size() + " component(s)");
        System.out.println();

        if (results.isEmpty()) {
            System.out.println("  Nothing to analyze.");
            return;
        }

        for (AnalysisResult result : results) {
            System.out.printf("  %s (%s)  score %d  %s%n",
                result.componentName(), result.componentId(), result.businessImpactScore(), result.riskLevel());
            System.out.printf("    Direct impacts:   %s%n", joined(result.directImpacts()));
            System.out.printf("    Indirect impacts: %s%n", joined(result.indirectImpacts()));
            System.out.printf("    Max depth:        %d%n", result.maxDepth());
            System.out.printf("    Workflows:        %s%n", joined(result.affectedWorkflows()));
            for (StepImpact step : result.affectedSteps()) {
                System.out.printf("      - %s / %s [%s]%n", step.workflowName(), step.stepName(), step.severity());
            }
            System.out.println();
        }
    }

    private static String joined(List<String> values) {
        return values.isEmpty() ? "-" : values.stream().collect(Collectors.joining(", "));
    }
}
