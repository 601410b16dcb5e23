package com.itiac.core.workflow;

import com.itiac.core.SnapshotTestBase;
import com.itiac.core.model.BusinessWorkflow;
import com.itiac.core.model.Criticality;
import com.itiac.core.model.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link WorkflowImpact#visibleSteps(StepView)}.
 */
class WorkflowImpactTest extends SnapshotTestBase {

    private static WorkflowImpact impactOn(BusinessWorkflow workflow, String... impactedIds) {
        return WorkflowImpactMapper.map(List.of(workflow), Set.of(impactedIds), Set.of(), Map.of()).get(0);
    }

    @Test
    @DisplayName("Scenario C: only the middle step is impacted")
    void visibleSteps_middleStepImpacted_viewsDiffer() {
        BusinessWorkflow workflow = workflow("w", Criticality.HIGH,
            step("first", 1, "ok"), step("middle", 2, "down"), step("last", 3, "ok"));

        WorkflowImpact impact = impactOn(workflow, "down");

        assertThat(impact.visibleSteps(StepView.IMPACTED_ONLY)).extracting(WorkflowStep::id)
            .containsExactly("middle");
        assertThat(impact.visibleSteps(StepView.IMPACTED_WITH_CONTEXT)).extracting(WorkflowStep::id)
            .containsExactly("first", "middle", "last");
        assertThat(impact.visibleSteps(StepView.ALL)).extracting(WorkflowStep::id)
            .containsExactly("first", "middle", "last");
    }

    @Test
    void visibleSteps_contextView_addsOnlyDirectNeighbours() {
        BusinessWorkflow workflow = workflow("w", Criticality.LOW,
            step("s1", 1, "ok"), step("s2", 2, "ok"), step("s3", 3, "down"),
            step("s4", 4, "ok"), step("s5", 5, "ok"));

        WorkflowImpact impact = impactOn(workflow, "down");

        assertThat(impact.visibleSteps(StepView.IMPACTED_WITH_CONTEXT)).extracting(WorkflowStep::id)
            .containsExactly("s2", "s3", "s4");
    }

    @Test
    void visibleSteps_impactedAtEdges_doesNotWrapAround() {
        BusinessWorkflow workflow = workflow("w", Criticality.LOW,
            step("s1", 1, "down"), step("s2", 2, "ok"), step("s3", 3, "ok"), step("s4", 4, "down"));

        WorkflowImpact impact = impactOn(workflow, "down");

        assertThat(impact.visibleSteps(StepView.IMPACTED_WITH_CONTEXT)).extracting(WorkflowStep::id)
            .containsExactly("s1", "s2", "s3", "s4");
        assertThat(impact.visibleSteps(StepView.IMPACTED_ONLY)).extracting(WorkflowStep::id)
            .containsExactly("s1", "s4");
    }

    @Test
    void visibleSteps_duplicateStepIds_keepsUnimpactedTwinHidden() {
        BusinessWorkflow workflow = workflow("w", Criticality.LOW,
            step("dup", 1, "down"), step("dup", 2, "ok"), step("s3", 3, "ok"));

        WorkflowImpact impact = impactOn(workflow, "down");

        assertThat(impact.visibleSteps(StepView.IMPACTED_ONLY)).extracting(WorkflowStep::order)
            .containsExactly(1);
        assertThat(impact.visibleStepIndices(StepView.IMPACTED_WITH_CONTEXT)).containsExactly(0, 1);
        assertThat(impact.impactAt(0)).isNotNull();
        assertThat(impact.impactAt(1)).isNull();
    }

    @Test
    void hasBlockingStep_withoutAlternatives_isTrue() {
        WorkflowImpact impact = impactOn(workflow("w", Criticality.LOW, step("s1", 1, "down")), "down");

        assertThat(impact.hasBlockingStep()).isTrue();
        assertThat(impact.workflowId()).isEqualTo("w");
    }
}
