package com.itiac.core.scoring;

import com.itiac.core.model.Criticality;

import java.util.List;
import java.util.Objects;

/**
 * Everything the scorer needs to know about one analyzed component.
 *
 * @param directCount number of one-hop impacts
 * @param indirectCount number of further impacts
 * @param affectedWorkflowCriticalities criticality of each affected workflow
 * @param blockingStepCount impacted steps without an online alternative
 * @param maxDepth longest shortest-path hop count reached
 * @param componentCriticality criticality of the analyzed component
 */
public record ImpactMetrics(
    int directCount,
    int indirectCount,
    List<Criticality> affectedWorkflowCriticalities,
    int blockingStepCount,
    int maxDepth,
    Criticality componentCriticality
) {
    /**
     * Compact constructor with validation.
     */
    public ImpactMetrics {
        if (directCount < 0 || indirectCount < 0 || blockingStepCount < 0 || maxDepth < 0) {
            throw new IllegalArgumentException("counts must not be negative");
        }
        Objects.requireNonNull(componentCriticality, "componentCriticality must not be null");
        affectedWorkflowCriticalities = affectedWorkflowCriticalities == null
            ? List.of()
            : List.copyOf(affectedWorkflowCriticalities);
    }

    /**
     * Total number of impacted components.
     *
     * @return direct plus indirect
     */
    public int totalImpacted() {
        return directCount + indirectCount;
    }
}
