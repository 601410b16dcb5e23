package com.itiac.core.scoring;

import com.itiac.core.model.Criticality;
import com.itiac.core.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ImpactScorer}.
 */
class ImpactScorerTest {

    private final ImpactScorer scorer = new ImpactScorer();

    private static ImpactMetrics metrics(int direct, int indirect, List<Criticality> workflows,
                                         int blocking, int depth, Criticality criticality) {
        return new ImpactMetrics(direct, indirect, workflows, blocking, depth, criticality);
    }

    @Test
    void score_nothingImpacted_isZero() {
        assertThat(scorer.score(metrics(0, 0, List.of(), 0, 0, Criticality.CRITICAL))).isZero();
        assertThat(scorer.riskLevel(0)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void score_sumsAllTermsBeforeMultiplier() {
        // 2*12 + 1*8 + 20 + 1*5 + 2*3 + 3*2 = 69
        ImpactMetrics metrics = metrics(2, 1, List.of(Criticality.HIGH), 1, 2, Criticality.MEDIUM);

        assertThat(scorer.score(metrics)).isEqualTo(69);
        assertThat(scorer.riskLevel(69)).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void score_appliesComponentCriticalityMultiplier() {
        ImpactMetrics high = metrics(2, 1, List.of(Criticality.HIGH), 1, 2, Criticality.HIGH);
        ImpactMetrics critical = metrics(2, 1, List.of(Criticality.HIGH), 1, 2, Criticality.CRITICAL);

        // 69 * 1.5 = 103.5 rounds half up
        assertThat(scorer.score(high)).isEqualTo(104);
        assertThat(scorer.score(critical)).isEqualTo(138);
    }

    @Test
    void score_workflowWeightGrowsWithWorkflowCriticality() {
        int low = scorer.score(metrics(0, 0, List.of(Criticality.LOW), 0, 0, Criticality.LOW));
        int medium = scorer.score(metrics(0, 0, List.of(Criticality.MEDIUM), 0, 0, Criticality.LOW));
        int high = scorer.score(metrics(0, 0, List.of(Criticality.HIGH), 0, 0, Criticality.LOW));
        int critical = scorer.score(metrics(0, 0, List.of(Criticality.CRITICAL), 0, 0, Criticality.LOW));

        assertThat(List.of(low, medium, high, critical)).containsExactly(10, 15, 20, 30);
    }

    @ParameterizedTest
    @DisplayName("Each input grows on its own and the score never goes down")
    @CsvSource({
        "1,0,0,0,0",
        "0,1,0,0,0",
        "0,0,1,0,0",
        "0,0,0,1,0",
        "0,0,0,0,1"
    })
    void score_isMonotonicInEveryInput(int directStep, int indirectStep, int workflowStep,
                                       int blockingStep, int depthStep) {
        ImpactMetrics base = metrics(2, 3, List.of(Criticality.MEDIUM), 1, 2, Criticality.MEDIUM);
        List<Criticality> workflows = workflowStep == 0
            ? base.affectedWorkflowCriticalities()
            : List.of(Criticality.MEDIUM, Criticality.LOW);
        ImpactMetrics grown = metrics(
            base.directCount() + directStep,
            base.indirectCount() + indirectStep,
            workflows,
            base.blockingStepCount() + blockingStep,
            base.maxDepth() + depthStep,
            base.componentCriticality());

        assertThat(scorer.score(grown)).isGreaterThanOrEqualTo(scorer.score(base));
    }

    @ParameterizedTest
    @EnumSource(Criticality.class)
    void score_neverDecreasesWithComponentCriticality(Criticality criticality) {
        ImpactMetrics metrics = metrics(3, 4, List.of(Criticality.HIGH), 2, 3, criticality);

        for (Criticality higher : Criticality.values()) {
            if (higher.compareTo(criticality) > 0) {
                ImpactMetrics raised = metrics(3, 4, List.of(Criticality.HIGH), 2, 3, higher);
                assertThat(scorer.score(raised)).isGreaterThanOrEqualTo(scorer.score(metrics));
            }
        }
    }

    @ParameterizedTest
    @CsvSource({
        "0,LOW",
        "44,LOW",
        "45,MEDIUM",
        "89,MEDIUM",
        "90,HIGH",
        "149,HIGH",
        "150,CRITICAL",
        "10000,CRITICAL"
    })
    void riskLevel_thresholdBoundaries(int score, RiskLevel expected) {
        assertThat(scorer.riskLevel(score)).isEqualTo(expected);
    }

    @Test
    void score_hugeCounts_saturateInsteadOfOverflowing() {
        ImpactMetrics huge = metrics(Integer.MAX_VALUE, Integer.MAX_VALUE, List.of(), 0, 0, Criticality.CRITICAL);

        assertThat(scorer.score(huge)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void metrics_negativeCount_isRejected() {
        assertThatThrownBy(() -> metrics(-1, 0, List.of(), 0, 0, Criticality.LOW))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("negative");
    }

    @Test
    void constructor_nullPolicy_isRejected() {
        assertThatThrownBy(() -> new ImpactScorer(null)).isInstanceOf(NullPointerException.class);
    }
}
