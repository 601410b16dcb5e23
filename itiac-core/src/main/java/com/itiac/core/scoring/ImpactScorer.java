package com.itiac.core.scoring;

import com.itiac.core.model.Criticality;
import com.itiac.core.model.RiskLevel;

import java.util.Objects;

/**
 * Rule-based business impact scoring.
 *
 * <pre>
 * raw   = direct * directWeight
 *       + indirect * indirectWeight
 *       + sum(workflowWeight(criticality) for each affected workflow)
 *       + blockingSteps * blockingStepWeight
 *       + maxDepth * depthWeight
 *       + (direct + indirect) * breadthWeight
 * score = round(raw * multiplier(componentCriticality))
 * </pre>
 *
 * <p>All terms are non-negative and the multiplier never decreases with criticality, so the
 * score never decreases when any single input grows.
 */
public class ImpactScorer {

    private final ScoringPolicy policy;

    public ImpactScorer() {
        this(ScoringPolicy.defaults());
    }

    public ImpactScorer(ScoringPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public ScoringPolicy policy() {
        return policy;
    }

    /**
     * Computes the business impact score.
     *
     * @param metrics impact metrics of one component
     * @return score, never negative
     */
    public int score(ImpactMetrics metrics) {
        Objects.requireNonNull(metrics, "metrics must not be null");

        long raw = (long) metrics.directCount() * policy.directWeight()
            + (long) metrics.indirectCount() * policy.indirectWeight()
            + (long) metrics.blockingStepCount() * policy.blockingStepWeight()
            + (long) metrics.maxDepth() * policy.depthWeight()
            + (long) metrics.totalImpacted() * policy.breadthWeight();
        for (Criticality workflowCriticality : metrics.affectedWorkflowCriticalities()) {
            raw += policy.workflowWeight(workflowCriticality);
        }

        long score = Math.round(raw * policy.multiplier(metrics.componentCriticality()));
        return (int) Math.min(Integer.MAX_VALUE, score);
    }

    /**
     * Maps a score to a risk level using the policy thresholds.
     *
     * @param score business impact score
     * @return risk level
     */
    public RiskLevel riskLevel(int score) {
        return policy.riskLevelFor(score);
    }
}
