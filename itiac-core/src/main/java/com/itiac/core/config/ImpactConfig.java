package com.itiac.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.itiac.core.analysis.AnalysisScope;
import com.itiac.core.model.Criticality;
import com.itiac.core.scoring.ScoringPolicy;
import com.itiac.core.validation.DependencyValidator;

import java.util.Locale;
import java.util.Map;

/**
 * Root configuration of the impact analysis.
 *
 * <p>Loaded from {@code itiac.yaml}. Every section and every value is optional; anything left
 * out falls back to the defaults of {@link ScoringPolicy}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   scope: non-online        # or all-components
 *
 * scoring:
 *   weights:
 *     direct: 12
 *     indirect: 8
 *     blockingStep: 5
 *     depth: 3
 *     breadth: 2
 *   workflowWeights:
 *     critical: 30
 *     high: 20
 *   multipliers:
 *     high: 1.5
 *     critical: 2.0
 *   thresholds:
 *     medium: 45
 *     high: 90
 *     critical: 150
 *
 * validation:
 *   singlePointOfFailureThreshold: 2
 * }</pre>
 *
 * @param analysis analysis settings
 * @param scoring scoring settings
 * @param validation validation settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImpactConfig(
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("scoring") ScoringSettings scoring,
    @JsonProperty("validation") ValidationSettings validation
) {
    /** Default scope when none is configured */
    public static final String DEFAULT_SCOPE = "non-online";

    /** Default out-degree from which a component counts as a single point of failure */
    public static final int DEFAULT_SPOF_THRESHOLD = DependencyValidator.DEFAULT_SPOF_THRESHOLD;

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ImpactConfig defaults() {
        return new ImpactConfig(
            new AnalysisSettings(DEFAULT_SCOPE),
            new ScoringSettings(null, null, null, null),
            new ValidationSettings(DEFAULT_SPOF_THRESHOLD)
        );
    }

    /**
     * Builds the scoring policy, filling gaps with defaults.
     *
     * @return scoring policy
     * @throws IllegalArgumentException if the configured values break the policy rules
     */
    public ScoringPolicy scoringPolicy() {
        return scoring == null ? ScoringPolicy.defaults() : scoring.toPolicy();
    }

    /**
     * Returns the configured default analysis scope.
     *
     * @return scope, never single-component
     */
    public AnalysisScope defaultScope() {
        return analysis == null ? AnalysisScope.nonOnline() : analysis.toScope();
    }

    /**
     * Returns the configured single point of failure threshold.
     *
     * @return threshold
     */
    public int singlePointOfFailureThreshold() {
        if (validation == null || validation.singlePointOfFailureThreshold() == null) {
            return DEFAULT_SPOF_THRESHOLD;
        }
        return validation.singlePointOfFailureThreshold();
    }

    /**
     * Analysis settings.
     *
     * @param scope {@code non-online} or {@code all-components}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("scope") String scope
    ) {
        public AnalysisScope toScope() {
            if (scope == null) {
                return AnalysisScope.nonOnline();
            }
            return switch (scope.trim().toLowerCase(Locale.ROOT)) {
                case "all", "all-components" -> AnalysisScope.allComponents();
                case "non-online" -> AnalysisScope.nonOnline();
                default -> throw new IllegalArgumentException("Unknown analysis scope: " + scope);
            };
        }
    }

    /**
     * Scoring settings. Null members mean "use the default".
     *
     * @param weights per-impact weights
     * @param workflowWeights weight per affected workflow, keyed by criticality
     * @param multipliers component criticality multipliers, keyed by criticality
     * @param thresholds risk level thresholds
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScoringSettings(
        @JsonProperty("weights") WeightSettings weights,
        @JsonProperty("workflowWeights") Map<String, Integer> workflowWeights,
        @JsonProperty("multipliers") Map<String, Double> multipliers,
        @JsonProperty("thresholds") ThresholdSettings thresholds
    ) {
        /**
         * Merges these settings over the defaults.
         *
         * @return scoring policy
         */
        public ScoringPolicy toPolicy() {
            WeightSettings w = weights == null ? new WeightSettings(null, null, null, null, null) : weights;
            ThresholdSettings t = thresholds == null ? new ThresholdSettings(null, null, null) : thresholds;

            Map<Criticality, Integer> workflow = ScoringPolicy.defaultWorkflowWeights();
            if (workflowWeights != null) {
                workflowWeights.forEach((key, value) -> workflow.put(Criticality.fromValue(key), value));
            }
            Map<Criticality, Double> multiplier = ScoringPolicy.defaultMultipliers();
            if (multipliers != null) {
                multipliers.forEach((key, value) -> multiplier.put(Criticality.fromValue(key), value));
            }

            return new ScoringPolicy(
                orDefault(w.direct(), ScoringPolicy.DEFAULT_DIRECT_WEIGHT),
                orDefault(w.indirect(), ScoringPolicy.DEFAULT_INDIRECT_WEIGHT),
                orDefault(w.blockingStep(), ScoringPolicy.DEFAULT_BLOCKING_STEP_WEIGHT),
                orDefault(w.depth(), ScoringPolicy.DEFAULT_DEPTH_WEIGHT),
                orDefault(w.breadth(), ScoringPolicy.DEFAULT_BREADTH_WEIGHT),
                workflow,
                multiplier,
                orDefault(t.medium(), ScoringPolicy.DEFAULT_MEDIUM_THRESHOLD),
                orDefault(t.high(), ScoringPolicy.DEFAULT_HIGH_THRESHOLD),
                orDefault(t.critical(), ScoringPolicy.DEFAULT_CRITICAL_THRESHOLD)
            );
        }

        private static int orDefault(Integer value, int defaultValue) {
            return value != null ? value : defaultValue;
        }
    }

    /**
     * Per-impact weights.
     *
     * @param direct points per direct impact
     * @param indirect points per indirect impact
     * @param blockingStep points per blocked step
     * @param depth points per hop of chain depth
     * @param breadth points per impacted component
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WeightSettings(
        @JsonProperty("direct") Integer direct,
        @JsonProperty("indirect") Integer indirect,
        @JsonProperty("blockingStep") Integer blockingStep,
        @JsonProperty("depth") Integer depth,
        @JsonProperty("breadth") Integer breadth
    ) {}

    /**
     * Risk level thresholds (inclusive lower bounds).
     *
     * @param medium lowest medium score
     * @param high lowest high score
     * @param critical lowest critical score
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThresholdSettings(
        @JsonProperty("medium") Integer medium,
        @JsonProperty("high") Integer high,
        @JsonProperty("critical") Integer critical
    ) {}

    /**
     * Validation settings.
     *
     * @param singlePointOfFailureThreshold minimum out-degree of a single point of failure
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationSettings(
        @JsonProperty("singlePointOfFailureThreshold") Integer singlePointOfFailureThreshold
    ) {}
}
