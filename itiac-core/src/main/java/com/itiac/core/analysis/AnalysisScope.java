package com.itiac.core.analysis;

import com.itiac.core.model.Component;
import com.itiac.core.model.ComponentStatus;

import java.util.List;
import java.util.Objects;

/**
 * Selects which components {@link ImpactAnalysisEngine#computeAnalysisResults} analyzes.
 *
 * @param mode selection mode
 * @param componentId component id, only for {@link Mode#SINGLE}
 */
public record AnalysisScope(Mode mode, String componentId) {

    /**
     * Scope selection mode.
     */
    public enum Mode {
        /** One component, by id */
        SINGLE,
        /** Every component in the snapshot */
        ALL_COMPONENTS,
        /** Every component whose status is not online */
        NON_ONLINE
    }

    /**
     * Compact constructor with validation.
     */
    public AnalysisScope {
        Objects.requireNonNull(mode, "mode must not be null");
        if (mode == Mode.SINGLE) {
            Objects.requireNonNull(componentId, "componentId is required for a single-component scope");
        } else if (componentId != null) {
            throw new IllegalArgumentException("componentId is only allowed for a single-component scope");
        }
    }

    public static AnalysisScope single(String componentId) {
        return new AnalysisScope(Mode.SINGLE, componentId);
    }

    public static AnalysisScope allComponents() {
        return new AnalysisScope(Mode.ALL_COMPONENTS, null);
    }

    public static AnalysisScope nonOnline() {
        return new AnalysisScope(Mode.NON_ONLINE, null);
    }

    /**
     * Returns the ids to analyze. A single scope yields its id even when it is unknown.
     *
     * @param components component snapshot
     * @return ids in snapshot order
     */
    public List<String> select(List<Component> components) {
        return switch (mode) {
            case SINGLE -> List.of(componentId);
            case ALL_COMPONENTS -> components.stream().map(Component::id).toList();
            case NON_ONLINE -> components.stream()
                .filter(c -> c.status() != ComponentStatus.ONLINE)
                .map(Component::id)
                .toList();
        };
    }
}
