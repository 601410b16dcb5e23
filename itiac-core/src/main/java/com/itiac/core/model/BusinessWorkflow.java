package com.itiac.core.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A business process expressed as ordered steps running on infrastructure components.
 *
 * @param id workflow identifier
 * @param name workflow name
 * @param description optional description
 * @param businessProcess business process label
 * @param criticality business criticality
 * @param owner optional owner
 * @param lastModified last modification time, may be null
 * @param steps workflow steps (any order; see {@link #stepsInOrder()})
 */
public record BusinessWorkflow(
    String id,
    String name,
    String description,
    String businessProcess,
    Criticality criticality,
    String owner,
    Instant lastModified,
    List<WorkflowStep> steps
) {
    /**
     * Compact constructor with validation.
     */
    public BusinessWorkflow {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(criticality, "criticality must not be null");
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * Creates a workflow with only the fields the analysis reads.
     *
     * @param id workflow id
     * @param name workflow name
     * @param criticality criticality
     * @param steps steps
     * @return new workflow
     */
    public static BusinessWorkflow of(String id, String name, Criticality criticality, List<WorkflowStep> steps) {
        return new BusinessWorkflow(id, name, null, null, criticality, null, null, steps);
    }

    /**
     * Returns the steps sorted by {@link WorkflowStep#order()} ascending. Equal orders keep
     * their declared sequence.
     *
     * @return sorted steps
     */
    public List<WorkflowStep> stepsInOrder() {
        return steps.stream()
            .sorted(Comparator.comparingInt(WorkflowStep::order))
            .toList();
    }
}
