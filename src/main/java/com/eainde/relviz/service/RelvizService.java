package com.eainde.relviz.service;

import com.eainde.relviz.diagnostics.DiagnosticSink;
import com.eainde.relviz.fact.Fact;
import com.eainde.relviz.fact.FactParser;
import com.eainde.relviz.graph.ClusterGraphBuilder;
import com.eainde.relviz.graph.DiagramGraph;
import com.eainde.relviz.graph.StyleClassification;
import com.eainde.relviz.render.DotWriter;
import com.eainde.relviz.render.GraphvizRenderer;
import com.eainde.relviz.render.LayoutEngine;
import com.eainde.relviz.style.StyleLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * End-to-end pipeline: fact text and style sheets in, graph description,
 * DOT text or rendered image out.
 *
 * <pre>
 *   default style + style + (content) -> style model -> StyleClassification
 *   facts -> ClusterGraphBuilder -> DiagramGraph -> DOT -> layout engine
 * </pre>
 *
 * <p>Nothing is cached between calls; each call parses and builds from
 * scratch, so one instance serves concurrent requests.</p>
 */
public class RelvizService {

    private static final Logger log = LoggerFactory.getLogger(RelvizService.class);

    private final FactParser parser;
    private final StyleLoader styleLoader;
    private final DotWriter dotWriter;
    private final GraphvizRenderer renderer;

    public RelvizService(FactParser parser, StyleLoader styleLoader,
                         DotWriter dotWriter, GraphvizRenderer renderer) {
        this.parser = parser;
        this.styleLoader = styleLoader;
        this.dotWriter = dotWriter;
        this.renderer = renderer;
    }

    // =========================================================================
    //  Pipeline
    // =========================================================================

    public DiagramGraph buildGraph(DiagramRequest request, DiagnosticSink diagnostics) {
        List<Fact> facts = parseSource(request.facts());
        List<Fact> styleFacts = new ArrayList<>();
        if (request.defaultStyle()) {
            styleFacts.addAll(styleLoader.defaultStyleFacts());
        }
        if (request.style() != null) {
            styleFacts.addAll(parseSource(request.style()));
        }
        if (request.inlineStyle()) {
            styleFacts.addAll(facts);
        }
        log.debug("Building graph from {} facts with {} style facts", facts.size(), styleFacts.size());

        StyleClassification style = StyleClassification.of(styleFacts, diagnostics);
        DiagramGraph graph = new ClusterGraphBuilder(style, diagnostics).build(facts);
        log.debug("Graph has {} nodes, {} edges, {} top-level clusters",
                graph.nodes().size(), graph.edges().size(), graph.clusters().size());
        return graph;
    }

    public String toDot(DiagramRequest request, DiagnosticSink diagnostics) {
        return dotWriter.write(buildGraph(request, diagnostics));
    }

    public byte[] render(DiagramRequest request, LayoutEngine engine, String format, DiagnosticSink diagnostics) {
        String dot = toDot(request, diagnostics);
        return renderer.render(dot, engine, format);
    }

    /** Parses source text; a final newline is added so the last line needs none. */
    public List<Fact> parseSource(String text) {
        return parser.parse(text + "\n");
    }
}
