package com.itiac.core.graph;

import com.itiac.core.model.Component;
import com.itiac.core.model.Dependency;
import com.itiac.core.model.ImpactCause;
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
 * Attributes every impacted node to its nearest offline root.
 *
 * <p>Runs one breadth-first traversal per root, in root order, each with its own visited set.
 * A recorded cause is only replaced by a strictly shorter distance, so on equal distances the
 * root processed first keeps the node. A node already claimed by an earlier root at an equal
 * or shorter distance is not expanded again: nothing behind it can be improved by the current
 * root. Roots are causes only; they are never attributed and never traversed through.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Map<String, ImpactCause> causes = CauseAttributor.attribute(snapshot.components(), snapshot.dependencies());
 * ImpactCause cause = causes.get("db-replica");
 * // cause.rootCauseId() is the closest offline component, cause.hopDistance() >= 1
 * }</pre>
 */
public final class CauseAttributor {

    private static final Logger log = LoggerFactory.getLogger(CauseAttributor.class);

    private CauseAttributor() {
        // Utility class
    }

    /**
     * Attributes impacts from all offline components, processed in list order.
     *
     * @param components component snapshot
     * @param dependencies dependency snapshot
     * @return cause per impacted component id, in attribution order
     */
    public static Map<String, ImpactCause> attribute(List<Component> components, List<Dependency> dependencies) {
        Objects.requireNonNull(components, "components must not be null");
        Objects.requireNonNull(dependencies, "dependencies must not be null");

        List<String> roots = components.stream()
            .filter(Component::isOffline)
            .map(Component::id)
            .toList();
        if (roots.isEmpty()) {
            return Map.of();
        }
        return attribute(roots, GraphBuilder.buildForwardAdjacency(dependencies));
    }

    /**
     * Attributes impacts from the given roots, processed in iteration order.
     *
     * @param roots outage roots; iteration order decides ties
     * @param adjacency forward adjacency
     * @return cause per impacted component id, in attribution order
     */
    public static Map<String, ImpactCause> attribute(Iterable<String> roots, Map<String, List<String>> adjacency) {
        Objects.requireNonNull(roots, "roots must not be null");
        Objects.requireNonNull(adjacency, "adjacency must not be null");

        Set<String> rootSet = new LinkedHashSet<>();
        roots.forEach(rootSet::add);

        Map<String, ImpactCause> causes = new LinkedHashMap<>();
        for (String root : rootSet) {
            traverseFrom(root, rootSet, adjacency, causes);
        }

        log.debug("Attributed {} impacted node(s) to {} root(s)", causes.size(), rootSet.size());
        return Collections.unmodifiableMap(causes);
    }

    private static void traverseFrom(String root,
                                     Set<String> rootSet,
                                     Map<String, List<String>> adjacency,
                                     Map<String, ImpactCause> causes) {
        Set<String> visited = new HashSet<>();
        visited.add(root);
        Deque<Hop> queue = new ArrayDeque<>();
        queue.add(new Hop(root, 0));

        while (!queue.isEmpty()) {
            Hop hop = queue.poll();
            int distance = hop.distance() + 1;
            for (String next : GraphBuilder.successors(adjacency, hop.nodeId())) {
                if (!visited.add(next) || rootSet.contains(next)) {
                    continue;
                }
                ImpactCause previous = causes.get(next);
                if (previous != null && previous.hopDistance() <= distance) {
                    // claimed by an earlier root at least as close
                    continue;
                }
                causes.put(next, new ImpactCause(next, root, hop.nodeId(), distance));
                queue.add(new Hop(next, distance));
            }
        }
    }

    private record Hop(String nodeId, int distance) {
    }
}
