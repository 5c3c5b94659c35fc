package com.eainde.relviz.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DigraphTest {

    private static Digraph<String> graph(String... edges) {
        Digraph<String> graph = new Digraph<>();
        for (String edge : edges) {
            String[] ends = edge.split(">");
            graph.addEdge(ends[0], ends[1]);
        }
        return graph;
    }

    @Nested
    @DisplayName("Cycle search")
    class Cycles {

        @Test
        @DisplayName("should find nothing in an acyclic graph")
        void acyclic() {
            assertThat(graph("a>b", "b>c", "a>c").findCycle()).isEmpty();
        }

        @Test
        @DisplayName("should return the cycle in edge order from where it closes")
        void cycle() {
            assertThat(graph("x>a", "a>b", "b>c", "c>a").findCycle())
                    .hasValueSatisfying(cycle -> assertThat(cycle).containsExactly("a", "b", "c"));
        }

        @Test
        @DisplayName("should treat a self loop as a cycle")
        void selfLoop() {
            assertThat(graph("a>a").findCycle())
                    .hasValueSatisfying(cycle -> assertThat(cycle).containsExactly("a"));
        }
    }

    @Nested
    @DisplayName("Successors-first order")
    class Order {

        @Test
        @DisplayName("should put every node after all of its successors")
        void postOrder() {
            assertThat(graph("d>b1", "d>b2", "b1>a", "b2>a").successorsFirst())
                    .containsExactly("a", "b1", "b2", "d");
        }

        @Test
        @DisplayName("should include isolated nodes in insertion order")
        void isolated() {
            Digraph<String> graph = graph("b>a");
            graph.addNode("z");

            assertThat(graph.successorsFirst()).containsExactly("a", "b", "z");
        }

        @Test
        @DisplayName("should refuse to order a cyclic graph")
        void cyclic() {
            assertThatThrownBy(() -> graph("a>b", "b>a").successorsFirst())
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Transitive reduction")
    class Reduction {

        @Test
        @DisplayName("should drop shortcut edges and keep reachability")
        void shortcut() {
            Digraph<String> graph = graph("a>b", "b>c", "a>c");

            graph.transitiveReduction();

            assertThat(graph.hasEdge("a", "c")).isFalse();
            assertThat(graph.hasEdge("a", "b")).isTrue();
            assertThat(graph.hasEdge("b", "c")).isTrue();
            assertThat(graph.edgeCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should drop shortcuts over longer chains")
        void longChain() {
            Digraph<String> graph = graph("a>d", "a>b", "b>c", "c>d");

            graph.transitiveReduction();

            assertThat(graph.successors("a")).containsExactly("b");
        }

        @Test
        @DisplayName("should keep two genuinely separate parents")
        void separateParents() {
            Digraph<String> graph = graph("x>p1", "x>p2");

            graph.transitiveReduction();

            assertThat(graph.outDegree("x")).isEqualTo(2);
        }
    }

    // =========================================================================
    //  Deep graphs
    // =========================================================================

    @Nested
    @DisplayName("Long chains")
    class LongChains {

        private Digraph<Integer> chain(int length) {
            Digraph<Integer> graph = new Digraph<>();
            for (int i = 0; i < length - 1; i++) {
                graph.addEdge(i, i + 1);
            }
            return graph;
        }

        @Test
        @DisplayName("should search a very deep chain for cycles without exhausting the stack")
        void deepCycleSearch() {
            Digraph<Integer> graph = chain(200_000);

            assertThat(graph.findCycle()).isEmpty();

            graph.addEdge(199_999, 0);
            assertThat(graph.findCycle()).hasValueSatisfying(cycle -> {
                assertThat(cycle).hasSize(200_000);
                assertThat(cycle.get(0)).isZero();
            });
        }

        @Test
        @DisplayName("should order a very deep chain successors first")
        void deepOrder() {
            List<Integer> order = chain(200_000).successorsFirst();

            assertThat(order).hasSize(200_000);
            assertThat(order.get(0)).isEqualTo(199_999);
            assertThat(order.get(order.size() - 1)).isZero();
        }

        @Test
        @DisplayName("should reduce a deep chain with a shortcut edge")
        void deepReduction() {
            Digraph<Integer> graph = chain(10_000);
            graph.addEdge(0, 9_999);

            graph.transitiveReduction();

            assertThat(graph.successors(0)).containsExactly(1);
            assertThat(graph.edgeCount()).isEqualTo(9_999);
        }
    }
}
