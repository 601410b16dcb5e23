package com.itiac.core.scoring;

import com.itiac.core.model.Criticality;
import com.itiac.core.model.RiskLevel;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ScoringPolicy}.
 */
class ScoringPolicyTest {

    private static ScoringPolicy withThresholds(int medium, int high, int critical) {
        return new ScoringPolicy(12, 8, 5, 3, 2,
            ScoringPolicy.defaultWorkflowWeights(), ScoringPolicy.defaultMultipliers(),
            medium, high, critical);
    }

    @Test
    void defaults_exposeDocumentedConstants() {
        ScoringPolicy policy = ScoringPolicy.defaults();

        assertThat(policy.directWeight()).isEqualTo(12);
        assertThat(policy.indirectWeight()).isEqualTo(8);
        assertThat(policy.workflowWeight(Criticality.CRITICAL)).isEqualTo(30);
        assertThat(policy.multiplier(Criticality.HIGH)).isEqualTo(1.5);
        assertThat(policy.mediumThreshold()).isEqualTo(45);
        assertThat(policy.highThreshold()).isEqualTo(90);
        assertThat(policy.criticalThreshold()).isEqualTo(150);
    }

    @Test
    void riskLevelFor_customThresholds_areHonoured() {
        ScoringPolicy policy = withThresholds(10, 20, 30);

        assertThat(policy.riskLevelFor(9)).isEqualTo(RiskLevel.LOW);
        assertThat(policy.riskLevelFor(10)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(policy.riskLevelFor(20)).isEqualTo(RiskLevel.HIGH);
        assertThat(policy.riskLevelFor(30)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void constructor_nonAscendingThresholds_areRejected() {
        assertThatThrownBy(() -> withThresholds(90, 90, 150))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("strictly ascending");
        assertThatThrownBy(() -> withThresholds(0, 90, 150))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> withThresholds(45, 160, 150))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_negativeWeight_isRejected() {
        assertThatThrownBy(() -> new ScoringPolicy(-1, 8, 5, 3, 2,
            ScoringPolicy.defaultWorkflowWeights(), ScoringPolicy.defaultMultipliers(), 45, 90, 150))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not be negative");
    }

    @Test
    void constructor_decreasingMultipliers_areRejected() {
        Map<Criticality, Double> multipliers = ScoringPolicy.defaultMultipliers();
        multipliers.put(Criticality.CRITICAL, 0.5);

        assertThatThrownBy(() -> new ScoringPolicy(12, 8, 5, 3, 2,
            ScoringPolicy.defaultWorkflowWeights(), multipliers, 45, 90, 150))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must not decrease");
    }

    @Test
    void constructor_decreasingWorkflowWeights_areRejected() {
        Map<Criticality, Integer> weights = ScoringPolicy.defaultWorkflowWeights();
        weights.put(Criticality.LOW, 50);
        weights.put(Criticality.MEDIUM, 40);
        weights.put(Criticality.HIGH, 20);
        weights.put(Criticality.CRITICAL, 5);

        assertThatThrownBy(() -> new ScoringPolicy(12, 8, 5, 3, 2,
            weights, ScoringPolicy.defaultMultipliers(), 45, 90, 150))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("workflow weights must not decrease");
    }

    @Test
    void constructor_equalWorkflowWeights_areAccepted() {
        Map<Criticality, Integer> weights = ScoringPolicy.defaultWorkflowWeights();
        weights.replaceAll((criticality, weight) -> 10);

        ScoringPolicy policy = new ScoringPolicy(12, 8, 5, 3, 2,
            weights, ScoringPolicy.defaultMultipliers(), 45, 90, 150);

        assertThat(policy.workflowWeight(Criticality.CRITICAL)).isEqualTo(10);
    }

    @Test
    void constructor_missingWorkflowWeight_isRejected() {
        Map<Criticality, Integer> weights = ScoringPolicy.defaultWorkflowWeights();
        weights.remove(Criticality.LOW);

        assertThatThrownBy(() -> new ScoringPolicy(12, 8, 5, 3, 2,
            weights, ScoringPolicy.defaultMultipliers(), 45, 90, 150))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing a value for LOW");
    }

    @Test
    void constructor_copiesMaps() {
        Map<Criticality, Integer> weights = ScoringPolicy.defaultWorkflowWeights();
        ScoringPolicy policy = new ScoringPolicy(12, 8, 5, 3, 2,
            weights, ScoringPolicy.defaultMultipliers(), 45, 90, 150);

        weights.put(Criticality.LOW, 999);

        assertThat(policy.workflowWeight(Criticality.LOW)).isEqualTo(10);
    }
}
