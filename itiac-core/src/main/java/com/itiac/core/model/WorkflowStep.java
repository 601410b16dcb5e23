package com.itiac.core.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One step of a business workflow.
 *
 * <p>Older data references a single component through {@code primaryComponentId}; newer data
 * uses {@code primaryComponentIds}. Both are honoured, see {@link #referencedComponentIds()}.
 *
 * @param id step identifier
 * @param name step name
 * @param description optional description
 * @param order position within the workflow (ascending, not necessarily contiguous)
 * @param primaryComponentId legacy single component reference, may be null
 * @param primaryComponentIds components the step runs on
 * @param alternativeComponentIds components that can take over when a primary is down
 * @param fallbackWorkflowId optional fallback workflow reference
 */
public record WorkflowStep(
    String id,
    String name,
    String description,
    int order,
    String primaryComponentId,
    List<String> primaryComponentIds,
    List<String> alternativeComponentIds,
    String fallbackWorkflowId
) {
    /**
     * Compact constructor with validation.
     */
    public WorkflowStep {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        primaryComponentIds = primaryComponentIds == null ? List.of() : List.copyOf(primaryComponentIds);
        alternativeComponentIds = alternativeComponentIds == null ? List.of() : List.copyOf(alternativeComponentIds);
    }

    /**
     * Creates a step running on the given components.
     *
     * @param id step id
     * @param name step name
     * @param order step order
     * @param componentIds primary component ids
     * @return new step
     */
    public static WorkflowStep of(String id, String name, int order, String... componentIds) {
        return new WorkflowStep(id, name, null, order, null, List.of(componentIds), List.of(), null);
    }

    /**
     * Returns the legacy id (if any) followed by the list, deduplicated.
     *
     * @return referenced component ids in insertion order
     */
    public Set<String> referencedComponentIds() {
        Set<String> ids = new LinkedHashSet<>();
        if (primaryComponentId != null && !primaryComponentId.isBlank()) {
            ids.add(primaryComponentId);
        }
        for (String componentId : primaryComponentIds) {
            if (componentId != null && !componentId.isBlank()) {
                ids.add(componentId);
            }
        }
        return ids;
    }

    /**
     * Returns the referenced ids that are members of the given set, in reference order.
     *
     * @param ids ids to test against
     * @return matching referenced ids
     */
    public List<String> referencesWithin(Set<String> ids) {
        List<String> matches = new ArrayList<>();
        for (String componentId : referencedComponentIds()) {
            if (ids.contains(componentId)) {
                matches.add(componentId);
            }
        }
        return matches;
    }
}
