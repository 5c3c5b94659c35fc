package com.eainde.relviz.model;

import com.eainde.relviz.diagnostics.CollectingDiagnosticSink;
import com.eainde.relviz.fact.Fact;
import com.eainde.relviz.fact.FactParser;
import com.eainde.relviz.fact.ObjectFact;
import com.eainde.relviz.fact.RelationFact;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FactModelTest {

    private final FactParser parser = new FactParser();

    private FactModel model(String source) {
        return new FactModel(parser.parse(source));
    }

    // =========================================================================
    //  Generalization names
    // =========================================================================

    @Nested
    @DisplayName("Generalization discovery")
    class Generalizations {

        @Test
        @DisplayName("should recognize a self-declared generalization name and use it for bases")
        void selfDeclared() {
            FactModel model = new FactModel(List.of(
                    RelationFact.of("is-a", "is-a", "generalization"),
                    RelationFact.of("Derived", "is-a", "Base")));

            assertThat(model.getGeneralizations()).containsExactlyInAnyOrder("generalization", "is-a");
            assertThat(model.basesOf("Derived")).containsExactly("Base");
        }

        @Test
        @DisplayName("should close over names declared through other generalization names")
        void transitiveClosure() {
            FactModel model = model("""
                    is-a generalization generalization
                    subclasses is-a generalization
                    Car subclasses Vehicle
                    """);

            assertThat(model.getGeneralizations())
                    .containsExactlyInAnyOrder("generalization", "is-a", "subclasses");
            assertThat(model.isGeneralization("subclasses")).isTrue();
            assertThat(model.basesOf("Car")).containsExactly("Vehicle");
        }

        @Test
        @DisplayName("should ignore relations that are not generalizations")
        void plainRelations() {
            FactModel model = model("Car has Engine\n");

            assertThat(model.getGeneralizations()).containsExactly("generalization");
            assertThat(model.entity("Car")).isEmpty();
        }

        @Test
        @DisplayName("should report the number of generalizations found")
        void diagnostics() {
            CollectingDiagnosticSink sink = new CollectingDiagnosticSink();

            new FactModel(List.of(RelationFact.of("is-a", "generalization", "generalization")), sink);

            assertThat(sink.getMessages()).contains("2 generalizations found");
        }
    }

    // =========================================================================
    //  Attributes and linearization
    // =========================================================================

    @Nested
    @DisplayName("Attribute inheritance")
    class Inheritance {

        private static final String DIAMOND = """
                is-a generalization generalization
                D is-a B1
                D is-a B2
                B1 is-a A
                B2 is-a A
                t A
                  x: 1
                t B1
                  x: 2
                t B2
                t D
                """;

        @Test
        @DisplayName("should prefer the nearer ancestor over the shared one in a diamond")
        void diamond() {
            FactModel model = model(DIAMOND);

            assertThat(model.attributesOf("D")).containsEntry("x", "2");
            assertThat(model.linearizationOf("D")).containsExactly("D", "B1", "B2", "A");
        }

        @Test
        @DisplayName("should take sibling conflicts from the leftmost base")
        void siblingOrder() {
            FactModel model = model("""
                    is-a generalization generalization
                    C is-a Left, Right
                    t Left
                      color: red
                    t Right
                      color: blue
                      shape: box
                    """);

            assertThat(model.attributesOf("C"))
                    .containsEntry("color", "red")
                    .containsEntry("shape", "box");
        }

        @Test
        @DisplayName("should let own attributes override inherited ones")
        void ownAttributesWin() {
            FactModel model = model("""
                    is-a generalization generalization
                    t Base
                      color: red
                    t Derived is-a Base
                      color: green
                    """);

            assertThat(model.attributesOf("Derived")).containsExactly(Map.entry("color", "green"));
            assertThat(model.attributesOf("Base")).containsExactly(Map.entry("color", "red"));
        }

        @Test
        @DisplayName("should merge repeated object facts with the later one winning")
        void repeatedObjectFacts() {
            FactModel model = new FactModel(List.<Fact>of(
                    new ObjectFact("t", "A", Map.of("color", "red", "shape", "box")),
                    new ObjectFact("u", "A", Map.of("color", "blue"))));

            assertThat(model.entity("A")).hasValueSatisfying(entity -> {
                assertThat(entity.directAttrs()).containsEntry("color", "blue").containsEntry("shape", "box");
                assertThat(entity.isRoot()).isTrue();
            });
        }

        @Test
        @DisplayName("should return empty attributes for unknown names")
        void unknownName() {
            FactModel model = model("t A\n");

            assertThat(model.attributesOf("Nope")).isEmpty();
            assertThat(model.linearizationOf("Nope")).isEmpty();
        }

        @Test
        @DisplayName("should place every base before the entities derived from it")
        void basesFirstOrder() {
            FactModel model = model(DIAMOND);
            List<String> order = model.getEntities().stream().map(Entity::name).toList();

            assertThat(order.indexOf("A")).isLessThan(order.indexOf("B1"));
            assertThat(order.indexOf("A")).isLessThan(order.indexOf("B2"));
            assertThat(order.indexOf("B1")).isLessThan(order.indexOf("D"));
            assertThat(order.indexOf("B2")).isLessThan(order.indexOf("D"));
        }
    }

    // =========================================================================
    //  Errors
    // =========================================================================

    @Nested
    @DisplayName("Rejected hierarchies")
    class Errors {

        @Test
        @DisplayName("should reject circular generalization with the names involved")
        void cycle() {
            assertThatThrownBy(() -> model("""
                    is-a generalization generalization
                    A is-a B
                    B is-a A
                    """))
                    .isInstanceOf(CyclicInheritanceException.class)
                    .hasMessage("Circular generalization: A is-a B is-a A")
                    .satisfies(e -> assertThat(((CyclicInheritanceException) e).getCycle())
                            .containsExactly("A", "B"));
        }

        @Test
        @DisplayName("should reject contradictory base orders")
        void inconsistent() {
            assertThatThrownBy(() -> model("""
                    is-a generalization generalization
                    X is-a A, B
                    Y is-a B, A
                    Z is-a X, Y
                    """))
                    .isInstanceOf(InconsistentHierarchyException.class)
                    .satisfies(e -> {
                        InconsistentHierarchyException error = (InconsistentHierarchyException) e;
                        assertThat(error.getEntity()).isEqualTo("Z");
                        assertThat(error.getBases()).containsExactly("X", "Y");
                    });
        }
    }
}
