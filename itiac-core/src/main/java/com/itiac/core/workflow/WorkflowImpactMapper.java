package com.itiac.core.workflow;

import com.itiac.core.model.BusinessWorkflow;
import com.itiac.core.model.Component;
import com.itiac.core.model.ComponentStatus;
import com.itiac.core.model.StepImpact;
import com.itiac.core.model.StepSeverity;
import com.itiac.core.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps an impacted component set onto business workflows.
 *
 * <p>A step is impacted when any component it references is impacted <em>or</em> offline:
 * the propagator never reports roots as impacted, but a step running directly on an offline
 * component is obviously down. A workflow is affected when at least one of its steps is.
 *
 * <p>Affected workflows are ordered most critical first, then by number of impacted steps
 * (descending). Remaining ties keep workflow order.
 */
public final class WorkflowImpactMapper {

    private static final Logger log = LoggerFactory.getLogger(WorkflowImpactMapper.class);

    private static final Comparator<WorkflowImpact> SEVERITY_ORDER =
        Comparator.<WorkflowImpact>comparingInt(impact -> impact.workflow().criticality().severityRank())
            .thenComparing(Comparator.<WorkflowImpact>comparingInt(impact -> impact.impactedSteps().size()).reversed());

    private WorkflowImpactMapper() {
        // Utility class
    }

    /**
     * Determines the affected workflows.
     *
     * @param workflows workflows to inspect
     * @param impactedIds downstream-impacted component ids
     * @param offlineIds offline root ids
     * @param componentsById component lookup, used to check whether alternatives are online
     * @return affected workflows, most severe first
     */
    public static List<WorkflowImpact> map(List<BusinessWorkflow> workflows,
                                           Set<String> impactedIds,
                                           Set<String> offlineIds,
                                           Map<String, Component> componentsById) {
        Objects.requireNonNull(workflows, "workflows must not be null");
        Objects.requireNonNull(impactedIds, "impactedIds must not be null");
        Objects.requireNonNull(offlineIds, "offlineIds must not be null");
        Objects.requireNonNull(componentsById, "componentsById must not be null");

        Set<String> down = new HashSet<>(impactedIds);
        down.addAll(offlineIds);

        List<WorkflowImpact> affected = new ArrayList<>();
        for (BusinessWorkflow workflow : workflows) {
            List<WorkflowStep> steps = workflow.stepsInOrder();
            List<StepImpact> impactedSteps = new ArrayList<>();
            List<Integer> impactedIndices = new ArrayList<>();
            for (int i = 0; i < steps.size(); i++) {
                WorkflowStep step = steps.get(i);
                List<String> reasons = step.referencesWithin(down);
                if (reasons.isEmpty()) {
                    continue;
                }
                impactedSteps.add(new StepImpact(workflow.id(), workflow.name(), step.id(), step.name(),
                    reasons, severityOf(step, componentsById)));
                impactedIndices.add(i);
            }
            if (!impactedSteps.isEmpty()) {
                affected.add(new WorkflowImpact(workflow, steps, impactedSteps, impactedIndices));
            }
        }

        affected.sort(SEVERITY_ORDER);
        log.debug("{} of {} workflow(s) affected by {} impacted and {} offline component(s)",
            affected.size(), workflows.size(), impactedIds.size(), offlineIds.size());
        return List.copyOf(affected);
    }

    /**
     * Returns the ids of the affected workflows, in severity order.
     *
     * @param impacts output of {@link #map}
     * @return workflow ids
     */
    public static List<String> affectedWorkflowIds(List<WorkflowImpact> impacts) {
        return impacts.stream().map(WorkflowImpact::workflowId).toList();
    }

    /**
     * Flattens the impacted steps of all affected workflows.
     *
     * @param impacts output of {@link #map}
     * @return impacted steps
     */
    public static List<StepImpact> impactedSteps(List<WorkflowImpact> impacts) {
        return impacts.stream().flatMap(impact -> impact.impactedSteps().stream()).toList();
    }

    private static StepSeverity severityOf(WorkflowStep step, Map<String, Component> componentsById) {
        boolean alternativeOnline = step.alternativeComponentIds().stream()
            .map(componentsById::get)
            .anyMatch(component -> component != null && component.status() == ComponentStatus.ONLINE);
        return alternativeOnline ? StepSeverity.WARNING : StepSeverity.ERROR;
    }
}
