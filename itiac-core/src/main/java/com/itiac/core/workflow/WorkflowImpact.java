package com.itiac.core.workflow;

import com.itiac.core.model.BusinessWorkflow;
import com.itiac.core.model.StepImpact;
import com.itiac.core.model.WorkflowStep;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * An affected workflow together with its ordered steps and the impacted subset.
 *
 * @param workflow the workflow
 * @param stepsInOrder steps sorted by order
 * @param impactedSteps impacted steps, in step order
 * @param impactedIndices position in {@code stepsInOrder} of each impacted step
 */
public record WorkflowImpact(
    BusinessWorkflow workflow,
    List<WorkflowStep> stepsInOrder,
    List<StepImpact> impactedSteps,
    List<Integer> impactedIndices
) {
    public WorkflowImpact {
        Objects.requireNonNull(workflow, "workflow must not be null");
        stepsInOrder = stepsInOrder == null ? List.of() : List.copyOf(stepsInOrder);
        impactedSteps = impactedSteps == null ? List.of() : List.copyOf(impactedSteps);
        impactedIndices = impactedIndices == null ? List.of() : List.copyOf(impactedIndices);
        if (impactedIndices.size() != impactedSteps.size()) {
            throw new IllegalArgumentException("impactedIndices must match impactedSteps in size");
        }
        for (int index : impactedIndices) {
            if (index < 0 || index >= stepsInOrder.size()) {
                throw new IllegalArgumentException("impacted step index out of range: " + index);
            }
        }
    }

    public String workflowId() {
        return workflow.id();
    }

    /**
     * Returns the ids of impacted steps.
     *
     * @return impacted step ids in step order
     */
    public Set<String> impactedStepIds() {
        Set<String> ids = new LinkedHashSet<>();
        impactedSteps.forEach(step -> ids.add(step.stepId()));
        return ids;
    }

    /**
     * Returns whether any step is blocked rather than degraded.
     *
     * @return true if at least one impacted step has no online alternative
     */
    public boolean hasBlockingStep() {
        return impactedSteps.stream().anyMatch(StepImpact::isBlocking);
    }

    /**
     * Returns the impact of the step at a position of {@link #stepsInOrder()}.
     *
     * <p>Lookup is by position, so steps sharing an id are told apart.
     *
     * @param index step position
     * @return the step's impact, or null if the step is not impacted
     */
    public StepImpact impactAt(int index) {
        int slot = impactedIndices.indexOf(index);
        return slot < 0 ? null : impactedSteps.get(slot);
    }

    /**
     * Selects the steps to display.
     *
     * @param view requested view
     * @return visible steps in order
     */
    public List<WorkflowStep> visibleSteps(StepView view) {
        List<WorkflowStep> visible = new ArrayList<>();
        visibleStepIndices(view).forEach(i -> visible.add(stepsInOrder.get(i)));
        return List.copyOf(visible);
    }

    /**
     * Selects the positions of the steps to display.
     *
     * <p>{@link StepView#IMPACTED_WITH_CONTEXT} adds the neighbour before and after every
     * impacted step; impacted steps themselves are always kept.
     *
     * @param view requested view
     * @return ascending positions in {@link #stepsInOrder()}
     */
    public List<Integer> visibleStepIndices(StepView view) {
        Objects.requireNonNull(view, "view must not be null");
        Set<Integer> visible = new TreeSet<>();
        if (view == StepView.ALL) {
            for (int i = 0; i < stepsInOrder.size(); i++) {
                visible.add(i);
            }
            return List.copyOf(visible);
        }

        for (int i : impactedIndices) {
            visible.add(i);
            if (view == StepView.IMPACTED_WITH_CONTEXT) {
                if (i > 0) {
                    visible.add(i - 1);
                }
                if (i < stepsInOrder.size() - 1) {
                    visible.add(i + 1);
                }
            }
        }
        return List.copyOf(visible);
    }
}
