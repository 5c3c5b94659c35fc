package com.eainde.relviz.controller;

import com.eainde.relviz.diagnostics.CollectingDiagnosticSink;
import com.eainde.relviz.diagnostics.DiagnosticSink;
import com.eainde.relviz.diagnostics.LoggingDiagnosticSink;
import com.eainde.relviz.graph.DiagramGraph;
import com.eainde.relviz.render.LayoutEngine;
import com.eainde.relviz.service.DiagramRequest;
import com.eainde.relviz.service.RelvizService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Form endpoints behind the page at {@code /}.
 *
 * <ul>
 *   <li>{@code POST /render} renders the submitted facts with the chosen
 *       layout engine and returns the image.</li>
 *   <li>{@code POST /render/dot} returns the DOT text that would be rendered.</li>
 *   <li>{@code POST /render/graph} returns the graph description as JSON,
 *       with the diagnostics collected while building it.</li>
 * </ul>
 *
 * <p>Every request parses its facts and style sheets and builds its graph from
 * scratch. Errors are mapped to responses by {@link GlobalExceptionHandler}.</p>
 */
@Slf4j
@RestController
@RequestMapping("/render")
public class RenderController {

    static final String RENDER_ID = "renderId";

    private final RelvizService relvizService;
    private final boolean defaultStyle;
    private final boolean inlineStyle;
    private final String defaultFormat;

    public RenderController(RelvizService relvizService,
                            @Value("${relviz.style.default-enabled:true}") boolean defaultStyle,
                            @Value("${relviz.style.inline:true}") boolean inlineStyle,
                            @Value("${relviz.layout.default-format:svg}") String defaultFormat) {
        this.relvizService = relvizService;
        this.defaultStyle = defaultStyle;
        this.inlineStyle = inlineStyle;
        this.defaultFormat = defaultFormat;
    }

    @PostMapping
    public ResponseEntity<byte[]> render(@RequestParam("facts") String facts,
                                         @RequestParam("processor") String processor,
                                         @RequestParam(value = "format", required = false) String format,
                                         @RequestParam(value = "style", required = false) String style) {
        LayoutEngine engine = LayoutEngine.fromProcessor(processor);
        String outputFormat = format == null || format.isBlank() ? defaultFormat : format;
        return withRenderId(() -> {
            log.info("Rendering {} characters of facts with {} as {}", facts.length(), engine.processor(), outputFormat);
            byte[] image = relvizService.render(request(facts, style), engine, outputFormat, diagnostics());
            return ResponseEntity.ok()
                    .contentType(mediaTypeOf(outputFormat))
                    .body(image);
        });
    }

    @PostMapping(value = "/dot", produces = MediaType.TEXT_PLAIN_VALUE)
    public String dot(@RequestParam("facts") String facts,
                      @RequestParam(value = "style", required = false) String style) {
        return withRenderId(() -> relvizService.toDot(request(facts, style), diagnostics()));
    }

    @PostMapping(value = "/graph", produces = MediaType.APPLICATION_JSON_VALUE)
    public GraphResponse graph(@RequestParam("facts") String facts,
                               @RequestParam(value = "style", required = false) String style) {
        return withRenderId(() -> {
            CollectingDiagnosticSink collected = new CollectingDiagnosticSink(diagnostics());
            DiagramGraph graph = relvizService.buildGraph(request(facts, style), collected);
            return new GraphResponse(graph, collected.getMessages());
        });
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private DiagramRequest request(String facts, String style) {
        return new DiagramRequest(facts, style, defaultStyle, inlineStyle);
    }

    private static DiagnosticSink diagnostics() {
        return new LoggingDiagnosticSink(log);
    }

    static MediaType mediaTypeOf(String format) {
        return MediaTypeFactory.getMediaType("diagram." + format)
                .orElse(MediaType.APPLICATION_OCTET_STREAM);
    }

    private static <T> T withRenderId(Supplier<T> action) {
        MDC.put(RENDER_ID, UUID.randomUUID().toString().substring(0, 8));
        try {
            return action.get();
        } finally {
            MDC.remove(RENDER_ID);
        }
    }
}
