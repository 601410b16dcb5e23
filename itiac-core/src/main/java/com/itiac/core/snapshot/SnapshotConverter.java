package com.itiac.core.snapshot;

import com.itiac.core.model.BusinessWorkflow;
import com.itiac.core.model.Component;
import com.itiac.core.model.ComponentStatus;
import com.itiac.core.model.ComponentType;
import com.itiac.core.model.Criticality;
import com.itiac.core.model.Dependency;
import com.itiac.core.model.DependencyType;
import com.itiac.core.model.InfrastructureSnapshot;
import com.itiac.core.model.WorkflowStep;
import com.itiac.core.snapshot.SnapshotDocument.ComponentDocument;
import com.itiac.core.snapshot.SnapshotDocument.DependencyDocument;
import com.itiac.core.snapshot.SnapshotDocument.StepDocument;
import com.itiac.core.snapshot.SnapshotDocument.WorkflowDocument;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts a {@link SnapshotDocument} into the model, rejecting documents with missing
 * required fields or unknown enumeration values.
 *
 * <p>All violations are collected before failing so a broken export can be fixed in one go.
 * Optional enumerations of a dependency (type, criticality) fall back to the model defaults.
 */
public class SnapshotConverter {

    /**
     * Converts a document.
     *
     * @param document parsed document
     * @return snapshot
     * @throws SnapshotValidationException listing every violation found
     */
    public InfrastructureSnapshot convert(SnapshotDocument document) {
        if (document == null) {
            throw new SnapshotValidationException(List.of("snapshot: document is empty"));
        }
        List<String> violations = new ArrayList<>();

        List<Component> components = new ArrayList<>();
        List<ComponentDocument> componentDocs = orEmpty(document.components());
        for (int i = 0; i < componentDocs.size(); i++) {
            Component component = toComponent(componentDocs.get(i), "components[" + i + "]", violations);
            if (component != null) {
                components.add(component);
            }
        }

        List<Dependency> dependencies = new ArrayList<>();
        List<DependencyDocument> dependencyDocs = orEmpty(document.dependencies());
        for (int i = 0; i < dependencyDocs.size(); i++) {
            Dependency dependency = toDependency(dependencyDocs.get(i), "dependencies[" + i + "]", violations);
            if (dependency != null) {
                dependencies.add(dependency);
            }
        }

        List<BusinessWorkflow> workflows = new ArrayList<>();
        List<WorkflowDocument> workflowDocs = orEmpty(document.workflows());
        for (int i = 0; i < workflowDocs.size(); i++) {
            BusinessWorkflow workflow = toWorkflow(workflowDocs.get(i), "workflows[" + i + "]", violations);
            if (workflow != null) {
                workflows.add(workflow);
            }
        }

        if (!violations.isEmpty()) {
            throw new SnapshotValidationException(violations);
        }
        return new InfrastructureSnapshot(components, dependencies, workflows);
    }

    private Component toComponent(ComponentDocument doc, String path, List<String> violations) {
        if (doc == null) {
            violations.add(path + ": entry is null");
            return null;
        }
        int before = violations.size();
        String id = required(doc.id(), path + ".id", violations);
        String name = required(doc.name(), path + ".name", violations);
        ComponentType type = enumValue(doc.type(), path + ".type", ComponentType::fromValue, true, violations);
        ComponentStatus status = enumValue(doc.status(), path + ".status", ComponentStatus::fromValue, true, violations);
        Criticality criticality = enumValue(doc.criticality(), path + ".criticality", Criticality::fromValue, true, violations);
        Instant lastModified = timestamp(doc.lastModified(), path + ".lastModified", violations);
        if (violations.size() > before) {
            return null;
        }
        return new Component(id, name, type, status, criticality, doc.description(), doc.location(),
            doc.owner(), doc.vendor(), lastModified, doc.metadata());
    }

    private Dependency toDependency(DependencyDocument doc, String path, List<String> violations) {
        if (doc == null) {
            violations.add(path + ": entry is null");
            return null;
        }
        int before = violations.size();
        String sourceId = required(doc.sourceId(), path + ".sourceId", violations);
        String targetId = required(doc.targetId(), path + ".targetId", violations);
        DependencyType type = enumValue(doc.type(), path + ".type", DependencyType::fromValue, false, violations);
        Criticality criticality = enumValue(doc.criticality(), path + ".criticality", Criticality::fromValue, false, violations);
        if (violations.size() > before) {
            return null;
        }
        return new Dependency(doc.id(), sourceId, targetId, type, criticality, doc.description());
    }

    private BusinessWorkflow toWorkflow(WorkflowDocument doc, String path, List<String> violations) {
        if (doc == null) {
            violations.add(path + ": entry is null");
            return null;
        }
        int before = violations.size();
        String id = required(doc.id(), path + ".id", violations);
        String name = required(doc.name(), path + ".name", violations);
        Criticality criticality = enumValue(doc.criticality(), path + ".criticality", Criticality::fromValue, true, violations);
        Instant lastModified = timestamp(doc.lastModified(), path + ".lastModified", violations);

        List<WorkflowStep> steps = new ArrayList<>();
        List<StepDocument> stepDocs = orEmpty(doc.steps());
        for (int i = 0; i < stepDocs.size(); i++) {
            WorkflowStep step = toStep(stepDocs.get(i), path + ".steps[" + i + "]", violations);
            if (step != null) {
                steps.add(step);
            }
        }
        if (violations.size() > before) {
            return null;
        }
        return new BusinessWorkflow(id, name, doc.description(), doc.businessProcess(), criticality,
            doc.owner(), lastModified, steps);
    }

    private static void checkEntries(List<String> ids, String path, List<String> violations) {
        if (ids == null) {
            return;
        }
        for (int i = 0; i < ids.size(); i++) {
            String id = ids.get(i);
            if (id == null) {
                violations.add(path + "[" + i + "]: null entry");
            } else if (id.isBlank()) {
                violations.add(path + "[" + i + "]: blank entry");
            }
        }
    }

    private WorkflowStep toStep(StepDocument doc, String path, List<String> violations) {
        if (doc == null) {
            violations.add(path + ": entry is null");
            return null;
        }
        int before = violations.size();
        String id = required(doc.id(), path + ".id", violations);
        String name = required(doc.name(), path + ".name", violations);
        if (doc.order() == null) {
            violations.add(path + ".order: required field is missing");
        }
        checkEntries(doc.primaryComponentIds(), path + ".primaryComponentIds", violations);
        checkEntries(doc.alternativeComponentIds(), path + ".alternativeComponentIds", violations);
        if (violations.size() > before) {
            return null;
        }
        return new WorkflowStep(id, name, doc.description(), doc.order(), doc.primaryComponentId(),
            doc.primaryComponentIds(), doc.alternativeComponentIds(), doc.fallbackWorkflowId());
    }

    private static String required(String value, String path, List<String> violations) {
        if (value == null || value.isBlank()) {
            violations.add(path + ": required field is missing");
            return null;
        }
        return value;
    }

    private static <E extends Enum<E>> E enumValue(String value, String path, Function<String, E> parser,
                                                   boolean required, List<String> violations) {
        if (value == null || value.isBlank()) {
            if (required) {
                violations.add(path + ": required field is missing");
            }
            return null;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            violations.add(path + ": " + e.getMessage());
            return null;
        }
    }

    private static Instant timestamp(String value, String path, List<String> violations) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            violations.add(path + ": not an ISO-8601 instant: " + value);
            return null;
        }
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
