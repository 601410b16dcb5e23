package com.itiac.core.scoring;

import com.itiac.core.model.Criticality;
import com.itiac.core.model.RiskLevel;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Weights and risk thresholds of the business impact score.
 *
 * <p>Every weight and multiplier must be non-negative, workflow weights and multipliers must
 * not decrease with criticality, and thresholds must be strictly ascending; otherwise the score would stop
 * being monotonic and construction fails.
 *
 * @param directWeight points per direct impact
 * @param indirectWeight points per indirect impact
 * @param blockingStepWeight points per blocked workflow step
 * @param depthWeight points per hop of maximum chain depth
 * @param breadthWeight points per impacted component, direct or indirect
 * @param workflowWeights points per affected workflow, by workflow criticality
 * @param criticalityMultipliers multiplier by analyzed component criticality
 * @param mediumThreshold lowest score rated {@link RiskLevel#MEDIUM}
 * @param highThreshold lowest score rated {@link RiskLevel#HIGH}
 * @param criticalThreshold lowest score rated {@link RiskLevel#CRITICAL}
 */
public record ScoringPolicy(
    int directWeight,
    int indirectWeight,
    int blockingStepWeight,
    int depthWeight,
    int breadthWeight,
    Map<Criticality, Integer> workflowWeights,
    Map<Criticality, Double> criticalityMultipliers,
    int mediumThreshold,
    int highThreshold,
    int criticalThreshold
) {
    public static final int DEFAULT_DIRECT_WEIGHT = 12;
    public static final int DEFAULT_INDIRECT_WEIGHT = 8;
    public static final int DEFAULT_BLOCKING_STEP_WEIGHT = 5;
    public static final int DEFAULT_DEPTH_WEIGHT = 3;
    public static final int DEFAULT_BREADTH_WEIGHT = 2;

    public static final int DEFAULT_LOW_WORKFLOW_WEIGHT = 10;
    public static final int DEFAULT_MEDIUM_WORKFLOW_WEIGHT = 15;
    public static final int DEFAULT_HIGH_WORKFLOW_WEIGHT = 20;
    public static final int DEFAULT_CRITICAL_WORKFLOW_WEIGHT = 30;

    public static final double DEFAULT_LOW_MULTIPLIER = 1.0;
    public static final double DEFAULT_MEDIUM_MULTIPLIER = 1.0;
    public static final double DEFAULT_HIGH_MULTIPLIER = 1.5;
    public static final double DEFAULT_CRITICAL_MULTIPLIER = 2.0;

    public static final int DEFAULT_MEDIUM_THRESHOLD = 45;
    public static final int DEFAULT_HIGH_THRESHOLD = 90;
    public static final int DEFAULT_CRITICAL_THRESHOLD = 150;

    /**
     * Compact constructor with validation.
     */
    public ScoringPolicy {
        if (directWeight < 0 || indirectWeight < 0 || blockingStepWeight < 0
            || depthWeight < 0 || breadthWeight < 0) {
            throw new IllegalArgumentException("scoring weights must not be negative");
        }
        workflowWeights = complete(workflowWeights, "workflowWeights");
        criticalityMultipliers = complete(criticalityMultipliers, "criticalityMultipliers");

        for (Criticality criticality : Criticality.values()) {
            if (workflowWeights.get(criticality) < 0) {
                throw new IllegalArgumentException("workflow weight for " + criticality + " must not be negative");
            }
            if (criticalityMultipliers.get(criticality) < 0) {
                throw new IllegalArgumentException("multiplier for " + criticality + " must not be negative");
            }
        }
        double previous = 0;
        int previousWeight = 0;
        for (Criticality criticality : Criticality.values()) {
            double multiplier = criticalityMultipliers.get(criticality);
            if (multiplier < previous) {
                throw new IllegalArgumentException("multipliers must not decrease with criticality, "
                    + criticality + " has " + multiplier);
            }
            previous = multiplier;

            int weight = workflowWeights.get(criticality);
            if (weight < previousWeight) {
                throw new IllegalArgumentException("workflow weights must not decrease with criticality, "
                    + criticality + " has " + weight);
            }
            previousWeight = weight;
        }

        if (!(0 < mediumThreshold && mediumThreshold < highThreshold && highThreshold < criticalThreshold)) {
            throw new IllegalArgumentException(String.format(
                "risk thresholds must be strictly ascending and positive: medium=%d, high=%d, critical=%d",
                mediumThreshold, highThreshold, criticalThreshold));
        }
    }

    /**
     * Returns the default policy.
     *
     * @return default policy
     */
    public static ScoringPolicy defaults() {
        return new ScoringPolicy(
            DEFAULT_DIRECT_WEIGHT,
            DEFAULT_INDIRECT_WEIGHT,
            DEFAULT_BLOCKING_STEP_WEIGHT,
            DEFAULT_DEPTH_WEIGHT,
            DEFAULT_BREADTH_WEIGHT,
            defaultWorkflowWeights(),
            defaultMultipliers(),
            DEFAULT_MEDIUM_THRESHOLD,
            DEFAULT_HIGH_THRESHOLD,
            DEFAULT_CRITICAL_THRESHOLD
        );
    }

    public static Map<Criticality, Integer> defaultWorkflowWeights() {
        Map<Criticality, Integer> weights = new EnumMap<>(Criticality.class);
        weights.put(Criticality.LOW, DEFAULT_LOW_WORKFLOW_WEIGHT);
        weights.put(Criticality.MEDIUM, DEFAULT_MEDIUM_WORKFLOW_WEIGHT);
        weights.put(Criticality.HIGH, DEFAULT_HIGH_WORKFLOW_WEIGHT);
        weights.put(Criticality.CRITICAL, DEFAULT_CRITICAL_WORKFLOW_WEIGHT);
        return weights;
    }

    public static Map<Criticality, Double> defaultMultipliers() {
        Map<Criticality, Double> multipliers = new EnumMap<>(Criticality.class);
        multipliers.put(Criticality.LOW, DEFAULT_LOW_MULTIPLIER);
        multipliers.put(Criticality.MEDIUM, DEFAULT_MEDIUM_MULTIPLIER);
        multipliers.put(Criticality.HIGH, DEFAULT_HIGH_MULTIPLIER);
        multipliers.put(Criticality.CRITICAL, DEFAULT_CRITICAL_MULTIPLIER);
        return multipliers;
    }

    /**
     * Points for one affected workflow.
     *
     * @param criticality workflow criticality
     * @return workflow weight
     */
    public int workflowWeight(Criticality criticality) {
        return workflowWeights.get(criticality);
    }

    /**
     * Multiplier applied for the analyzed component's criticality.
     *
     * @param criticality component criticality
     * @return multiplier
     */
    public double multiplier(Criticality criticality) {
        return criticalityMultipliers.get(criticality);
    }

    /**
     * Maps a score to its risk level. A score equal to a threshold gets that threshold's level.
     *
     * @param score business impact score
     * @return risk level
     */
    public RiskLevel riskLevelFor(int score) {
        if (score >= criticalThreshold) {
            return RiskLevel.CRITICAL;
        }
        if (score >= highThreshold) {
            return RiskLevel.HIGH;
        }
        if (score >= mediumThreshold) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static <V> Map<Criticality, V> complete(Map<Criticality, V> values, String name) {
        Objects.requireNonNull(values, name + " must not be null");
        for (Criticality criticality : Criticality.values()) {
            if (values.get(criticality) == null) {
                throw new IllegalArgumentException(name + " is missing a value for " + criticality);
            }
        }
        return Map.copyOf(values);
    }
}
