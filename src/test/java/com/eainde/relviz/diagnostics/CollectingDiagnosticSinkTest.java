package com.eainde.relviz.diagnostics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CollectingDiagnosticSinkTest {

    @Mock
    private DiagnosticSink downstream;

    @Test
    @DisplayName("should keep diagnostics in order and pass each one on")
    void collectsAndForwards() {
        // Arrange
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink(downstream);

        // Act
        sink.model("%d generalizations found", 3);
        sink.graph("Adding node for %s %s", "class", "Car");

        // Assert
        assertThat(sink.getMessages()).containsExactly("3 generalizations found", "Adding node for class Car");
        assertThat(sink.getDiagnostics()).extracting(Diagnostic::stage)
                .containsExactly(Diagnostic.Stage.MODEL, Diagnostic.Stage.GRAPH);
        verify(downstream).report(new Diagnostic(Diagnostic.Stage.MODEL, "3 generalizations found"));
        verify(downstream).report(new Diagnostic(Diagnostic.Stage.GRAPH, "Adding node for class Car"));
    }

    @Test
    @DisplayName("should print the stage before the message")
    void format() {
        assertThat(new Diagnostic(Diagnostic.Stage.GRAPH, "Skipping object x y")).hasToString("[GRAPH] Skipping object x y");
    }
}
