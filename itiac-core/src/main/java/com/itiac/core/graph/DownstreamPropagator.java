package com.itiac.core.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Breadth-first propagation of outages along the forward adjacency.
 *
 * <p>One visited set is shared by all roots and is seeded with the roots, so a root is never
 * reported as impacted and every node is enqueued at most once. That bounds the queue by the
 * node count and guarantees termination on cyclic graphs: O(V + E).
 */
public final class DownstreamPropagator {

    private static final Logger log = LoggerFactory.getLogger(DownstreamPropagator.class);

    private DownstreamPropagator() {
        // Utility class
    }

    /**
     * Returns every node reachable from any root, excluding the roots and the stop-set.
     *
     * <p>Stop-set members are neither reported nor expanded. The conventional stop-set is the
     * root set itself.
     *
     * @param roots outage roots
     * @param adjacency forward adjacency
     * @param stopSet ids never reported or traversed through, or null
     * @return impacted ids in discovery order
     */
    public static Set<String> propagate(Iterable<String> roots,
                                        Map<String, List<String>> adjacency,
                                        Set<String> stopSet) {
        Objects.requireNonNull(roots, "roots must not be null");
        Objects.requireNonNull(adjacency, "adjacency must not be null");
        Set<String> stops = stopSet == null ? Set.of() : stopSet;

        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String root : roots) {
            if (visited.add(root)) {
                queue.add(root);
            }
        }
        if (queue.isEmpty()) {
            return Set.of();
        }
        int rootCount = queue.size();

        Set<String> impacted = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : GraphBuilder.successors(adjacency, current)) {
                if (!visited.add(next)) {
                    continue;
                }
                if (stops.contains(next)) {
                    continue;
                }
                impacted.add(next);
                queue.add(next);
            }
        }

        log.debug("Propagated outage from {} root(s) to {} node(s)", rootCount, impacted.size());
        return Collections.unmodifiableSet(impacted);
    }

    /**
     * Returns the hop distance of every node reachable from a single origin.
     *
     * <p>The origin itself is excluded even when a cycle leads back to it.
     *
     * @param originId node to start from
     * @param adjacency forward adjacency
     * @return hop distances (at least 1) in discovery order
     */
    public static Map<String, Integer> distancesFrom(String originId, Map<String, List<String>> adjacency) {
        Objects.requireNonNull(originId, "originId must not be null");
        Objects.requireNonNull(adjacency, "adjacency must not be null");

        Map<String, Integer> distances = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        visited.add(originId);
        Deque<String> queue = new ArrayDeque<>();
        queue.add(originId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int nextDistance = distances.getOrDefault(current, 0) + 1;
            for (String next : GraphBuilder.successors(adjacency, current)) {
                if (visited.add(next)) {
                    distances.put(next, nextDistance);
                    queue.add(next);
                }
            }
        }
        return Collections.unmodifiableMap(distances);
    }
}
