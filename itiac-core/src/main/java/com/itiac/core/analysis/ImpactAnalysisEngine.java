package com.itiac.core.analysis;

import com.itiac.core.graph.CauseAttributor;
import com.itiac.core.graph.DownstreamPropagator;
import com.itiac.core.graph.GraphBuilder;
import com.itiac.core.model.AnalysisResult;
import com.itiac.core.model.BusinessWorkflow;
import com.itiac.core.model.Component;
import com.itiac.core.model.Criticality;
import com.itiac.core.model.Dependency;
import com.itiac.core.model.ImpactCause;
import com.itiac.core.model.InfrastructureSnapshot;
import com.itiac.core.model.RiskLevel;
import com.itiac.core.model.StepImpact;
import com.itiac.core.scoring.ImpactMetrics;
import com.itiac.core.scoring.ImpactScorer;
import com.itiac.core.scoring.ScoringPolicy;
import com.itiac.core.workflow.WorkflowImpact;
import com.itiac.core.workflow.WorkflowImpactMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point of the impact analysis.
 *
 * <p>Every operation is a pure function of the snapshot passed in: nothing is cached and the
 * inputs are never mutated, so one engine can be shared by concurrent callers.
 *
 * <p>Outages propagate along the stored edge direction, {@code source -> target}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ImpactAnalysisEngine engine = new ImpactAnalysisEngine(ScoringPolicy.defaults());
 * Set<String> impacted = engine.computeDownstreamImpact(snapshot.components(), snapshot.dependencies(), null);
 * List<AnalysisResult> results = engine.computeAnalysisResults(snapshot, AnalysisScope.nonOnline());
 * }</pre>
 */
public class ImpactAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(ImpactAnalysisEngine.class);

    private static final Comparator<AnalysisResult> BY_SCORE_DESCENDING =
        Comparator.comparingInt(AnalysisResult::businessImpactScore).reversed();

    private final ImpactScorer scorer;

    public ImpactAnalysisEngine() {
        this(ScoringPolicy.defaults());
    }

    public ImpactAnalysisEngine(ScoringPolicy policy) {
        this.scorer = new ImpactScorer(policy);
    }

    public ScoringPolicy scoringPolicy() {
        return scorer.policy();
    }

    /**
     * Builds the forward adjacency, optionally restricted to an allow-set.
     *
     * @param dependencies dependency edges
     * @param allowedIds ids both endpoints must belong to, or null
     * @return adjacency {@code sourceId -> targetIds}
     */
    public Map<String, List<String>> buildForwardAdjacency(List<Dependency> dependencies, Set<String> allowedIds) {
        return GraphBuilder.buildForwardAdjacency(dependencies, allowedIds);
    }

    /**
     * Computes the components impacted by the current outage, i.e. everything downstream of an
     * offline component, excluding the offline components themselves.
     *
     * @param components component snapshot
     * @param dependencies dependency snapshot
     * @param visibleIds ids to restrict the graph to, or null for the whole graph
     * @return impacted ids, empty if nothing is offline
     */
    public Set<String> computeDownstreamImpact(List<Component> components,
                                               List<Dependency> dependencies,
                                               Set<String> visibleIds) {
        Objects.requireNonNull(components, "components must not be null");
        Objects.requireNonNull(dependencies, "dependencies must not be null");

        Set<String> offlineIds = new LinkedHashSet<>();
        for (Component component : components) {
            if (component.isOffline()) {
                offlineIds.add(component.id());
            }
        }
        if (offlineIds.isEmpty()) {
            return Set.of();
        }

        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(dependencies, visibleIds);
        return DownstreamPropagator.propagate(offlineIds, adjacency, offlineIds);
    }

    /**
     * Attributes every impacted component to its nearest offline root.
     *
     * @param snapshot infrastructure snapshot
     * @return cause per impacted component id
     */
    public Map<String, ImpactCause> computeImpactCauses(InfrastructureSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return CauseAttributor.attribute(snapshot.components(), snapshot.dependencies());
    }

    /**
     * Attributes impacts within a visible subset of the graph.
     *
     * @param snapshot infrastructure snapshot
     * @param visibleIds ids both endpoints of a followed edge must belong to, or null
     * @return cause per impacted component id; keys equal {@link #computeDownstreamImpact}
     */
    public Map<String, ImpactCause> computeImpactCauses(InfrastructureSnapshot snapshot, Set<String> visibleIds) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        if (visibleIds == null) {
            return computeImpactCauses(snapshot);
        }
        return CauseAttributor.attribute(snapshot.offlineComponentIds(),
            GraphBuilder.buildForwardAdjacency(snapshot.dependencies(), visibleIds));
    }

    /**
     * Determines the workflows affected by the current outage.
     *
     * @param snapshot infrastructure snapshot
     * @param visibleIds ids to restrict the graph to, or null
     * @return affected workflows, most severe first
     */
    public List<WorkflowImpact> mapWorkflowImpact(InfrastructureSnapshot snapshot, Set<String> visibleIds) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Set<String> impacted = computeDownstreamImpact(snapshot.components(), snapshot.dependencies(), visibleIds);
        return WorkflowImpactMapper.map(snapshot.workflows(), impacted, snapshot.offlineComponentIds(),
            snapshot.componentsById());
    }

    /**
     * Analyzes every component selected by the scope.
     *
     * @param snapshot infrastructure snapshot
     * @param scope which components to analyze
     * @return results sorted by business impact score, highest first
     */
    public List<AnalysisResult> computeAnalysisResults(InfrastructureSnapshot snapshot, AnalysisScope scope) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(scope, "scope must not be null");

        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(snapshot.dependencies());
        Map<String, Component> componentsById = snapshot.componentsById();

        List<AnalysisResult> results = new ArrayList<>();
        for (String componentId : scope.select(snapshot.components())) {
            results.add(analyze(componentId, componentsById, adjacency, snapshot.workflows()));
        }
        results.sort(BY_SCORE_DESCENDING);

        log.debug("Analyzed {} component(s) in scope {}", results.size(), scope.mode());
        return List.copyOf(results);
    }

    /**
     * Analyzes what would be impacted if one component went down.
     *
     * @param componentId component to analyze
     * @param snapshot infrastructure snapshot
     * @return analysis result; an empty low-risk result for unknown ids
     */
    public AnalysisResult analyzeImpact(String componentId, InfrastructureSnapshot snapshot) {
        Objects.requireNonNull(componentId, "componentId must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        return analyze(componentId, snapshot.componentsById(),
            GraphBuilder.buildForwardAdjacency(snapshot.dependencies()), snapshot.workflows());
    }

    private AnalysisResult analyze(String componentId,
                                   Map<String, Component> componentsById,
                                   Map<String, List<String>> adjacency,
                                   List<BusinessWorkflow> workflows) {
        Component component = componentsById.get(componentId);
        if (component == null) {
            log.warn("Component {} is not in the snapshot; reporting it as unknown", componentId);
            return AnalysisResult.unknown(componentId);
        }

        Map<String, Integer> distances = DownstreamPropagator.distancesFrom(componentId, adjacency);

        List<String> direct = new ArrayList<>();
        List<String> indirect = new ArrayList<>();
        distances.forEach((id, distance) -> (distance == 1 ? direct : indirect).add(id));
        int maxDepth = distances.values().stream().mapToInt(Integer::intValue).max().orElse(0);

        List<WorkflowImpact> workflowImpacts = WorkflowImpactMapper.map(
            workflows, distances.keySet(), Set.of(componentId), componentsById);
        List<StepImpact> steps = WorkflowImpactMapper.impactedSteps(workflowImpacts);
        List<Criticality> workflowCriticalities = workflowImpacts.stream()
            .map(impact -> impact.workflow().criticality())
            .toList();
        int blockingSteps = (int) steps.stream().filter(StepImpact::isBlocking).count();

        ImpactMetrics metrics = new ImpactMetrics(direct.size(), indirect.size(), workflowCriticalities,
            blockingSteps, maxDepth, component.criticality());
        int score = scorer.score(metrics);
        RiskLevel riskLevel = scorer.riskLevel(score);

        return new AnalysisResult(
            componentId,
            component.name(),
            direct,
            indirect,
            WorkflowImpactMapper.affectedWorkflowIds(workflowImpacts),
            steps,
            maxDepth,
            score,
            riskLevel
        );
    }
}
