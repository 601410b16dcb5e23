package com.itiac.core.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Impact analysis of one component, recomputed on every invocation.
 *
 * @param componentId analyzed component
 * @param componentName analyzed component name ({@code "Unknown"} if not in the snapshot)
 * @param directImpacts ids one hop downstream
 * @param indirectImpacts ids further downstream
 * @param affectedWorkflows ids of workflows with at least one impacted step
 * @param affectedSteps impacted steps across all workflows
 * @param maxDepth longest shortest-path hop count from the component (0 if nothing is reached)
 * @param businessImpactScore score from the impact scorer
 * @param riskLevel discrete risk label
 */
public record AnalysisResult(
    String componentId,
    String componentName,
    List<String> directImpacts,
    List<String> indirectImpacts,
    List<String> affectedWorkflows,
    List<StepImpact> affectedSteps,
    int maxDepth,
    int businessImpactScore,
    RiskLevel riskLevel
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(componentId, "componentId must not be null");
        Objects.requireNonNull(riskLevel, "riskLevel must not be null");
        if (componentName == null) {
            componentName = "Unknown";
        }
        directImpacts = directImpacts == null ? List.of() : List.copyOf(directImpacts);
        indirectImpacts = indirectImpacts == null ? List.of() : List.copyOf(indirectImpacts);
        affectedWorkflows = affectedWorkflows == null ? List.of() : List.copyOf(affectedWorkflows);
        affectedSteps = affectedSteps == null ? List.of() : List.copyOf(affectedSteps);
    }

    /**
     * Result for an id that is not in the snapshot.
     *
     * @param componentId requested id
     * @return empty, low-risk result
     */
    public static AnalysisResult unknown(String componentId) {
        return new AnalysisResult(componentId, "Unknown", List.of(), List.of(), List.of(), List.of(),
            0, 0, RiskLevel.LOW);
    }

    /**
     * Returns every impacted id, direct first.
     *
     * @return direct then indirect impacts
     */
    public List<String> impactedComponentIds() {
        return Stream.concat(directImpacts.stream(), indirectImpacts.stream()).toList();
    }
}
