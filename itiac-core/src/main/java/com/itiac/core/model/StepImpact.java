package com.itiac.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An impacted workflow step and the components that explain it.
 *
 * @param workflowId owning workflow
 * @param workflowName owning workflow name
 * @param stepId step id
 * @param stepName step name
 * @param reasonComponentIds referenced components that are impacted or offline
 * @param severity {@link StepSeverity#WARNING} if an alternative is online, else {@link StepSeverity#ERROR}
 */
public record StepImpact(
    String workflowId,
    String workflowName,
    String stepId,
    String stepName,
    List<String> reasonComponentIds,
    StepSeverity severity
) {
    /**
     * Compact constructor with validation.
     */
    public StepImpact {
        Objects.requireNonNull(workflowId, "workflowId must not be null");
        Objects.requireNonNull(stepId, "stepId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        reasonComponentIds = reasonComponentIds == null ? List.of() : List.copyOf(reasonComponentIds);
    }

    /**
     * Returns whether the step is blocked (no online alternative).
     *
     * @return true for {@link StepSeverity#ERROR}
     */
    public boolean isBlocking() {
        return severity == StepSeverity.ERROR;
    }
}
