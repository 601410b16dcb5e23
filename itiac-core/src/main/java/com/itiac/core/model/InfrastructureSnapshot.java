package com.itiac.core.model;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Consistent, read-only copy of everything the analysis looks at.
 *
 * <p>Acquiring a consistent snapshot is the caller's job; nothing in the analysis mutates it.
 *
 * @param components infrastructure components
 * @param dependencies dependency edges
 * @param workflows business workflows
 */
public record InfrastructureSnapshot(
    List<Component> components,
    List<Dependency> dependencies,
    List<BusinessWorkflow> workflows
) {
    /**
     * Compact constructor with validation.
     */
    public InfrastructureSnapshot {
        components = components == null ? List.of() : List.copyOf(components);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        workflows = workflows == null ? List.of() : List.copyOf(workflows);
    }

    /**
     * Creates an empty snapshot.
     *
     * @return empty snapshot
     */
    public static InfrastructureSnapshot empty() {
        return new InfrastructureSnapshot(List.of(), List.of(), List.of());
    }

    /**
     * Indexes components by id. Later duplicates are ignored.
     *
     * @return components keyed by id, in snapshot order
     */
    public Map<String, Component> componentsById() {
        Map<String, Component> byId = new LinkedHashMap<>();
        for (Component component : components) {
            byId.putIfAbsent(component.id(), component);
        }
        return byId;
    }

    /**
     * Looks up a component.
     *
     * @param id component id
     * @return the component, or empty for unknown ids
     */
    public Optional<Component> findComponent(String id) {
        return components.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    /**
     * Returns the display name of a component, or {@code "Unknown"} for dangling ids.
     *
     * @param id component id
     * @return component name
     */
    public String nameOf(String id) {
        return findComponent(id).map(Component::name).orElse("Unknown");
    }

    /**
     * Returns the ids of offline components in snapshot order.
     *
     * @return outage root ids
     */
    public Set<String> offlineComponentIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Component component : components) {
            if (component.isOffline()) {
                ids.add(component.id());
            }
        }
        return ids;
    }
}
