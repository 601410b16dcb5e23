package com.itiac.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An IT infrastructure component (server, database, API, etc.).
 *
 * <p>Identity is the {@code id}. The analysis only ever reads a snapshot of components;
 * creating and updating them is the storage layer's business.
 *
 * @param id unique, stable identifier
 * @param name display name
 * @param type component type
 * @param status operational status
 * @param criticality business criticality
 * @param description optional description
 * @param location optional location
 * @param owner optional owner
 * @param vendor optional vendor
 * @param lastModified last modification time, may be null
 * @param metadata free-form metadata, passed through untouched
 */
public record Component(
    String id,
    String name,
    ComponentType type,
    ComponentStatus status,
    Criticality criticality,
    String description,
    String location,
    String owner,
    String vendor,
    Instant lastModified,
    Map<String, Object> metadata
) {
    /**
     * Compact constructor with validation.
     */
    public Component {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(criticality, "criticality must not be null");
        // metadata values may be null in exported data
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Creates a component with only the fields the analysis reads.
     *
     * @param id identifier
     * @param name display name
     * @param type component type
     * @param status status
     * @param criticality criticality
     * @return new component
     */
    public static Component of(String id, String name, ComponentType type,
                               ComponentStatus status, Criticality criticality) {
        return new Component(id, name, type, status, criticality,
            null, null, null, null, null, Map.of());
    }

    /**
     * Returns whether this component is an outage root.
     *
     * @return true if the status is offline
     */
    public boolean isOffline() {
        return status == ComponentStatus.OFFLINE;
    }

    /**
     * Returns a copy with another status.
     *
     * @param newStatus replacement status
     * @return updated copy
     */
    public Component withStatus(ComponentStatus newStatus) {
        return new Component(id, name, type, newStatus, criticality,
            description, location, owner, vendor, lastModified, metadata);
    }
}
