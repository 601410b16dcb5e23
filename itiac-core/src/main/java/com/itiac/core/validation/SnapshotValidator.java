package com.itiac.core.validation;

import com.itiac.core.model.BusinessWorkflow;
import com.itiac.core.model.Component;
import com.itiac.core.model.Dependency;
import com.itiac.core.model.InfrastructureSnapshot;
import com.itiac.core.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Integrity checks over a whole snapshot.
 *
 * <p>Errors: duplicate component ids, dependency endpoints that reference no component, and
 * self-loops. Warnings: duplicate edges, duplicate step ids within a workflow, step references
 * and alternatives naming unknown components, and implausible dependency types. The analysis runs on snapshots with such problems anyway;
 * this report is for whoever owns the data.
 */
public final class SnapshotValidator {

    private static final Logger log = LoggerFactory.getLogger(SnapshotValidator.class);

    private SnapshotValidator() {
        // Utility class
    }

    /**
     * Inspects a snapshot.
     *
     * @param snapshot snapshot to inspect
     * @return errors and warnings found
     */
    public static ValidationResult inspect(InfrastructureSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Set<String> seen = new HashSet<>();
        for (Component component : snapshot.components()) {
            if (!seen.add(component.id())) {
                errors.add("Duplicate component id: " + component.id());
            }
        }

        Map<String, Component> byId = snapshot.componentsById();
        Set<String> edges = new HashSet<>();
        for (Dependency dependency : snapshot.dependencies()) {
            Component source = byId.get(dependency.sourceId());
            Component target = byId.get(dependency.targetId());
            if (source == null) {
                errors.add("Dependency " + dependency.id() + " references unknown source " + dependency.sourceId());
            }
            if (target == null) {
                errors.add("Dependency " + dependency.id() + " references unknown target " + dependency.targetId());
            }
            if (dependency.sourceId().equals(dependency.targetId())) {
                errors.add("Dependency " + dependency.id() + " is a self-loop on " + dependency.sourceId());
            }
            if (!edges.add(dependency.sourceId() + "\u0000" + dependency.targetId())) {
                warnings.add("Dependency " + dependency.id() + " duplicates an existing edge "
                    + dependency.sourceId() + " -> " + dependency.targetId());
            }
            if (source != null && target != null) {
                DependencyValidator.validateDependencyType(source.type(), target.type(), dependency.type())
                    .forEach(w -> warnings.add("Dependency " + dependency.id() + ": " + w));
            }
        }

        for (BusinessWorkflow workflow : snapshot.workflows()) {
            Set<String> stepIds = new HashSet<>();
            for (WorkflowStep step : workflow.steps()) {
                if (!stepIds.add(step.id())) {
                    warnings.add("Workflow " + workflow.id() + " has duplicate step id " + step.id());
                }
                for (String componentId : step.referencedComponentIds()) {
                    if (!byId.containsKey(componentId)) {
                        warnings.add("Workflow " + workflow.id() + " step " + step.id()
                            + " references unknown component " + componentId);
                    }
                }
                // unknown alternatives count as unavailable when rating step severity
                for (String componentId : step.alternativeComponentIds()) {
                    if (!byId.containsKey(componentId)) {
                        warnings.add("Workflow " + workflow.id() + " step " + step.id()
                            + " names unknown alternative component " + componentId);
                    }
                }
            }
        }

        log.debug("Snapshot inspection found {} error(s) and {} warning(s)", errors.size(), warnings.size());
        return new ValidationResult(errors, warnings);
    }
}
