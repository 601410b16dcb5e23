package com.itiac.core.graph;

import com.itiac.core.model.Dependency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the forward adjacency used by every traversal: {@code sourceId -> [targetId, ...]}.
 *
 * <p>Successor lists keep edge order and are not deduplicated; parallel edges appear twice.
 * When an allow-set is given (for example the ids currently visible to a caller), edges with
 * either endpoint outside it are skipped. Without an allow-set, dangling endpoints are kept
 * as-is and callers must tolerate ids that resolve to no component.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(snapshot.dependencies());
 * Set<String> impacted = DownstreamPropagator.propagate(roots, adjacency, roots);
 * }</pre>
 */
public final class GraphBuilder {

    private GraphBuilder() {
        // Utility class
    }

    /**
     * Builds the forward adjacency of all edges.
     *
     * @param dependencies dependency edges
     * @return unmodifiable adjacency, keyed in first-seen order
     */
    public static Map<String, List<String>> buildForwardAdjacency(Iterable<Dependency> dependencies) {
        return buildForwardAdjacency(dependencies, null);
    }

    /**
     * Builds the forward adjacency restricted to an allow-set.
     *
     * @param dependencies dependency edges
     * @param allowedIds ids both endpoints must belong to, or null for no restriction
     * @return unmodifiable adjacency, keyed in first-seen order
     */
    public static Map<String, List<String>> buildForwardAdjacency(Iterable<Dependency> dependencies,
                                                                  Set<String> allowedIds) {
        Objects.requireNonNull(dependencies, "dependencies must not be null");

        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (Dependency dependency : dependencies) {
            if (allowedIds != null
                && (!allowedIds.contains(dependency.sourceId()) || !allowedIds.contains(dependency.targetId()))) {
                continue;
            }
            adjacency.computeIfAbsent(dependency.sourceId(), k -> new ArrayList<>()).add(dependency.targetId());
        }

        Map<String, List<String>> frozen = new LinkedHashMap<>();
        adjacency.forEach((source, targets) -> frozen.put(source, List.copyOf(targets)));
        return Collections.unmodifiableMap(frozen);
    }

    /**
     * Returns the successors of a node, or an empty list if it has none.
     *
     * @param adjacency forward adjacency
     * @param nodeId node id
     * @return successor ids
     */
    public static List<String> successors(Map<String, List<String>> adjacency, String nodeId) {
        return adjacency.getOrDefault(nodeId, List.of());
    }
}
