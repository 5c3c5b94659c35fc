package com.eainde.relviz.style;

import com.eainde.relviz.fact.Fact;
import com.eainde.relviz.fact.FactParser;
import com.eainde.relviz.fact.ObjectFact;
import com.eainde.relviz.graph.StyleClassification;
import com.eainde.relviz.diagnostics.DiagnosticSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StyleLoaderTest {

    private final FactParser parser = new FactParser();

    @Test
    @DisplayName("should load the bundled style sheet from the classpath")
    void bundledStyle() {
        StyleLoader loader = new StyleLoader(StyleLoader.DEFAULT_LOCATION, parser);

        StyleClassification style = StyleClassification.of(loader.defaultStyleFacts(), DiagnosticSink.NONE);

        assertThat(style.nodeTypes()).contains("class", "interface", "note");
        assertThat(style.clusterTypes()).contains("package");
        assertThat(style.containments()).contains("in");
        assertThat(style.getStyles().getGeneralizations()).contains("is-a", "subclasses");
        assertThat(style.styleOf("is-a")).containsEntry("arrowhead", "empty");
        assertThat(style.styleOf("class")).containsEntry("shape", "box");
    }

    @Test
    @DisplayName("should fall back to the barebone style when the sheet is missing")
    void barebone() {
        StyleLoader loader = new StyleLoader("classpath:relviz/missing.style", parser);

        assertThat(loader.loadDefaultStyle()).isEqualTo(StyleLoader.BAREBONE_STYLE);
        List<Fact> facts = loader.defaultStyleFacts();
        assertThat(facts).contains(ObjectFact.of("edge-type", "is-a"), ObjectFact.of("edge-type", "subclasses"));
    }

    @Test
    @DisplayName("should read a style sheet from a file location")
    void fileLocation(@TempDir Path dir) throws IOException {
        Path sheet = dir.resolve("my.style");
        Files.writeString(sheet, "node-type box");

        StyleLoader loader = new StyleLoader("file:" + sheet, parser);

        assertThat(loader.defaultStyleFacts()).containsExactly(ObjectFact.of("node-type", "box"));
    }

    @Test
    @DisplayName("should hand out a fresh list every time")
    void freshList() {
        StyleLoader loader = new StyleLoader(StyleLoader.DEFAULT_LOCATION, parser);

        List<Fact> first = loader.defaultStyleFacts();
        first.clear();

        assertThat(loader.defaultStyleFacts()).isNotEmpty();
    }
}
