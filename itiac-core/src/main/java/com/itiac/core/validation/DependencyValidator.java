package com.itiac.core.validation;

import com.itiac.core.graph.DownstreamPropagator;
import com.itiac.core.graph.GraphBuilder;
import com.itiac.core.model.ComponentType;
import com.itiac.core.model.Dependency;
import com.itiac.core.model.DependencyType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks applied to dependency edges before they are stored, plus graph-wide health checks.
 *
 * <p>The impact analysis itself tolerates cycles and duplicates; these checks exist so that
 * editors can warn users about graphs that are probably wrong.
 */
public final class DependencyValidator {

    /** Default minimum out-degree for {@link #singlePointsOfFailure(List, int)} */
    public static final int DEFAULT_SPOF_THRESHOLD = 2;

    private static final Map<ComponentType, Map<DependencyType, Set<ComponentType>>> TYPE_RULES = typeRules();

    private DependencyValidator() {
        // Utility class
    }

    /**
     * Validates a new or edited dependency against the existing ones.
     *
     * @param candidate dependency to add
     * @param existing stored dependencies
     * @return errors for self-loops, duplicates and cycles
     */
    public static ValidationResult validate(Dependency candidate, List<Dependency> existing) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(existing, "existing must not be null");

        List<String> errors = new ArrayList<>();
        if (candidate.sourceId().equals(candidate.targetId())) {
            errors.add("A component cannot depend on itself");
        }

        boolean duplicate = existing.stream().anyMatch(dep ->
            dep.sourceId().equals(candidate.sourceId())
                && dep.targetId().equals(candidate.targetId())
                && !dep.id().equals(candidate.id()));
        if (duplicate) {
            errors.add("This dependency already exists");
        }

        if (wouldCreateCycle(candidate, existing)) {
            errors.add("This dependency would create a circular dependency");
        }
        return new ValidationResult(errors, List.of());
    }

    /**
     * Returns whether adding the candidate closes a cycle, i.e. its target already reaches its
     * source. A self-loop counts as a cycle.
     *
     * @param candidate dependency to add
     * @param existing stored dependencies
     * @return true if a cycle would be created
     */
    public static boolean wouldCreateCycle(Dependency candidate, List<Dependency> existing) {
        if (candidate.sourceId().equals(candidate.targetId())) {
            return true;
        }
        List<Dependency> all = new ArrayList<>(existing);
        all.add(candidate);
        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(all);
        return DownstreamPropagator.distancesFrom(candidate.targetId(), adjacency).containsKey(candidate.sourceId());
    }

    /**
     * Finds cycles with a depth-first search. Each cycle is reported as the path that closes
     * it, with the first node repeated at the end ({@code [a, b, a]}).
     *
     * @param dependencies dependency edges
     * @return cycles found, in discovery order
     */
    public static List<List<String>> detectAllCycles(List<Dependency> dependencies) {
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(dependencies);

        Set<String> nodes = new LinkedHashSet<>();
        for (Dependency dependency : dependencies) {
            nodes.add(dependency.sourceId());
            nodes.add(dependency.targetId());
        }

        List<List<String>> cycles = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        for (String node : nodes) {
            if (!visited.contains(node)) {
                findCycles(node, adjacency, visited, onStack, new ArrayList<>(), cycles);
            }
        }
        return cycles;
    }

    private static void findCycles(String node,
                                   Map<String, List<String>> adjacency,
                                   Set<String> visited,
                                   Set<String> onStack,
                                   List<String> path,
                                   List<List<String>> cycles) {
        visited.add(node);
        onStack.add(node);
        path.add(node);

        for (String next : GraphBuilder.successors(adjacency, node)) {
            if (!visited.contains(next)) {
                findCycles(next, adjacency, visited, onStack, new ArrayList<>(path), cycles);
            } else if (onStack.contains(next)) {
                int start = path.indexOf(next);
                if (start >= 0) {
                    List<String> cycle = new ArrayList<>(path.subList(start, path.size()));
                    cycle.add(next);
                    cycles.add(List.copyOf(cycle));
                }
            }
        }

        onStack.remove(node);
    }

    /**
     * Finds components many others hang off while having at most one dependency of their own:
     * out-degree at least {@code threshold} and in-degree at most one.
     *
     * @param dependencies dependency edges
     * @param threshold minimum out-degree
     * @return component ids in first-seen order
     */
    public static List<String> singlePointsOfFailure(List<Dependency> dependencies, int threshold) {
        Objects.requireNonNull(dependencies, "dependencies must not be null");

        Map<String, int[]> degrees = new LinkedHashMap<>();
        for (Dependency dependency : dependencies) {
            degrees.computeIfAbsent(dependency.sourceId(), k -> new int[2])[1]++;
            degrees.computeIfAbsent(dependency.targetId(), k -> new int[2])[0]++;
        }

        List<String> spofs = new ArrayList<>();
        degrees.forEach((id, inOut) -> {
            if (inOut[1] >= threshold && inOut[0] <= 1) {
                spofs.add(id);
            }
        });
        return spofs;
    }

    /**
     * Checks whether a dependency makes sense for the component types involved.
     *
     * @param sourceType type of the source component
     * @param targetType type of the target component
     * @param dependencyType dependency type
     * @return warnings, empty when the combination is plausible or not covered by a rule
     */
    public static List<String> validateDependencyType(ComponentType sourceType,
                                                      ComponentType targetType,
                                                      DependencyType dependencyType) {
        Map<DependencyType, Set<ComponentType>> rules = TYPE_RULES.get(sourceType);
        if (rules == null) {
            return List.of();
        }
        Set<ComponentType> allowed = rules.get(dependencyType);
        if (allowed == null || allowed.contains(targetType)) {
            return List.of();
        }
        return List.of(String.format("%s typically doesn't %s %s",
            sourceType.value(), verb(dependencyType), targetType.value()));
    }

    private static String verb(DependencyType type) {
        return switch (type) {
            case REQUIRES -> "require";
            case USES -> "use";
            case FEEDS -> "feed";
            case MONITORS -> "monitor";
        };
    }

    private static Map<ComponentType, Map<DependencyType, Set<ComponentType>>> typeRules() {
        Map<ComponentType, Map<DependencyType, Set<ComponentType>>> rules = new EnumMap<>(ComponentType.class);

        Map<DependencyType, Set<ComponentType>> loadBalancer = new EnumMap<>(DependencyType.class);
        loadBalancer.put(DependencyType.FEEDS, Set.of(ComponentType.SERVER, ComponentType.APPLICATION));
        loadBalancer.put(DependencyType.REQUIRES, Set.of(ComponentType.NETWORK));
        loadBalancer.put(DependencyType.USES, Set.of(ComponentType.NETWORK));
        rules.put(ComponentType.LOAD_BALANCER, loadBalancer);

        Map<DependencyType, Set<ComponentType>> api = new EnumMap<>(DependencyType.class);
        api.put(DependencyType.REQUIRES, Set.of(ComponentType.DATABASE, ComponentType.SERVICE));
        api.put(DependencyType.USES, Set.of(ComponentType.DATABASE, ComponentType.SERVICE, ComponentType.NETWORK));
        rules.put(ComponentType.API, api);

        Map<DependencyType, Set<ComponentType>> application = new EnumMap<>(DependencyType.class);
        application.put(DependencyType.REQUIRES, Set.of(ComponentType.API, ComponentType.DATABASE));
        application.put(DependencyType.USES, Set.of(ComponentType.API, ComponentType.SERVICE, ComponentType.NETWORK));
        rules.put(ComponentType.APPLICATION, application);

        Map<DependencyType, Set<ComponentType>> database = new EnumMap<>(DependencyType.class);
        database.put(DependencyType.REQUIRES, Set.of(ComponentType.SERVER, ComponentType.NETWORK));
        database.put(DependencyType.MONITORS, Set.of(ComponentType.SERVER));
        rules.put(ComponentType.DATABASE, database);

        return rules;
    }
}
