package com.itiac.core.model;

import java.util.Objects;

/**
 * Explains why a component is impacted: the nearest offline root and how far away it is.
 *
 * @param componentId impacted component
 * @param rootCauseId offline root at the minimal hop distance
 * @param immediateCauseId predecessor of the component on that shortest path
 * @param hopDistance number of edges from the root, at least 1
 */
public record ImpactCause(
    String componentId,
    String rootCauseId,
    String immediateCauseId,
    int hopDistance
) {
    /**
     * Compact constructor with validation.
     */
    public ImpactCause {
        Objects.requireNonNull(componentId, "componentId must not be null");
        Objects.requireNonNull(rootCauseId, "rootCauseId must not be null");
        Objects.requireNonNull(immediateCauseId, "immediateCauseId must not be null");
        if (hopDistance < 1) {
            throw new IllegalArgumentException("hopDistance must be >= 1, was " + hopDistance);
        }
    }

    /**
     * Returns whether the root directly feeds this component.
     *
     * @return true for one-hop impacts
     */
    public boolean isDirect() {
        return hopDistance == 1;
    }
}
