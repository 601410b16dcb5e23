package com.itiac.core.model;

import java.util.Objects;

/**
 * Directed dependency edge between two components.
 *
 * <p>Outages propagate along the stored direction: {@code source -> target}. If the source
 * goes offline, the target is considered impacted.
 *
 * @param id dependency identifier
 * @param sourceId component the edge starts from
 * @param targetId component the edge points to
 * @param type dependency type (defaults to {@link DependencyType#REQUIRES})
 * @param criticality edge criticality (defaults to {@link Criticality#MEDIUM})
 * @param description optional description
 */
public record Dependency(
    String id,
    String sourceId,
    String targetId,
    DependencyType type,
    Criticality criticality,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public Dependency {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        if (id == null) {
            id = sourceId + "->" + targetId;
        }
        if (type == null) {
            type = DependencyType.REQUIRES;
        }
        if (criticality == null) {
            criticality = Criticality.MEDIUM;
        }
    }

    /**
     * Creates a {@code requires} edge with a derived id.
     *
     * @param sourceId source component id
     * @param targetId target component id
     * @return new dependency
     */
    public static Dependency of(String sourceId, String targetId) {
        return new Dependency(null, sourceId, targetId, null, null, null);
    }
}
