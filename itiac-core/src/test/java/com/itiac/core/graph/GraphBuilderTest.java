package com.itiac.core.graph;

import com.itiac.core.SnapshotTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GraphBuilder}.
 */
class GraphBuilderTest extends SnapshotTestBase {

    @Test
    void buildForwardAdjacency_mapsSourceToTargetsInEdgeOrder() {
        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(
            edges("a", "b", "a", "c", "b", "c"));

        assertThat(adjacency).containsOnlyKeys("a", "b");
        assertThat(adjacency.get("a")).containsExactly("b", "c");
        assertThat(adjacency.get("b")).containsExactly("c");
    }

    @Test
    void buildForwardAdjacency_keepsParallelEdges() {
        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(edges("a", "b", "a", "b"));

        assertThat(adjacency.get("a")).containsExactly("b", "b");
    }

    @Test
    void buildForwardAdjacency_withAllowSet_skipsEdgesLeavingIt() {
        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(
            edges("a", "b", "b", "c", "x", "a"), Set.of("a", "b"));

        assertThat(adjacency).containsOnlyKeys("a");
        assertThat(adjacency.get("a")).containsExactly("b");
    }

    @Test
    void buildForwardAdjacency_withoutAllowSet_keepsDanglingTargets() {
        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(edges("a", "ghost"));

        assertThat(adjacency.get("a")).containsExactly("ghost");
    }

    @Test
    void buildForwardAdjacency_emptyEdges_returnsEmptyMap() {
        assertThat(GraphBuilder.buildForwardAdjacency(List.of())).isEmpty();
    }

    @Test
    void buildForwardAdjacency_resultIsUnmodifiable() {
        Map<String, List<String>> adjacency = GraphBuilder.buildForwardAdjacency(edges("a", "b"));

        assertThatThrownBy(() -> adjacency.put("x", List.of()))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> adjacency.get("a").add("z"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void successors_unknownNode_returnsEmptyList() {
        assertThat(GraphBuilder.successors(Map.of(), "nope")).isEmpty();
    }
}
