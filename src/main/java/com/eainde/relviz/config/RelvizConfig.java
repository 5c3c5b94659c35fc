package com.eainde.relviz.config;

import com.eainde.relviz.fact.FactParser;
import com.eainde.relviz.render.DotWriter;
import com.eainde.relviz.render.GraphvizRenderer;
import com.eainde.relviz.render.LayoutEngine;
import com.eainde.relviz.service.RelvizService;
import com.eainde.relviz.style.StyleLoader;
import com.eainde.relviz.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Wires the rendering pipeline from {@code relviz.*} properties. The
 * per-request style and format defaults are read by the controller.
 *
 * <pre>
 * relviz:
 *   style:
 *     default-enabled: true
 *     default-location: classpath:relviz/default.style
 *     inline: true
 *   layout:
 *     engines:
 *       dot: /usr/bin/dot
 *       fdp: /usr/bin/fdp
 *     timeout-seconds: 30
 *     default-format: svg
 * </pre>
 */
@Slf4j
@Configuration
public class RelvizConfig {

    // =========================================================================
    //  Style
    // =========================================================================

    @Value("${relviz.style.default-location:" + StyleLoader.DEFAULT_LOCATION + "}")
    private String defaultStyleLocation;

    // =========================================================================
    //  Layout
    // =========================================================================

    @Value("${relviz.layout.engines.dot:/usr/bin/dot}")
    private String dotExecutable;

    @Value("${relviz.layout.engines.fdp:/usr/bin/fdp}")
    private String fdpExecutable;

    @Value("${relviz.layout.timeout-seconds:30}")
    private long timeoutSeconds;

    @Bean
    public FactParser factParser() {
        return new FactParser();
    }

    @Bean
    public StyleLoader styleLoader(ResourceLoader resourceLoader, FactParser factParser) {
        log.info("Default style sheet: {}", defaultStyleLocation);
        return new StyleLoader(resourceLoader, defaultStyleLocation, factParser);
    }

    @Bean
    public DotWriter dotWriter() {
        return new DotWriter();
    }

    @Bean
    public MdcAwareExecutor layoutStreamExecutor() {
        return new MdcAwareExecutor("relviz-layout-io-");
    }

    @Bean
    public GraphvizRenderer graphvizRenderer(MdcAwareExecutor layoutStreamExecutor) {
        Map<LayoutEngine, String> executables = new EnumMap<>(LayoutEngine.class);
        executables.put(LayoutEngine.DOT, dotExecutable);
        executables.put(LayoutEngine.FDP, fdpExecutable);
        log.info("Layout engines: {}, timeout {}s", executables, timeoutSeconds);
        return new GraphvizRenderer(executables, Duration.ofSeconds(timeoutSeconds), layoutStreamExecutor);
    }

    @Bean
    public RelvizService relvizService(FactParser factParser, StyleLoader styleLoader,
                                       DotWriter dotWriter, GraphvizRenderer graphvizRenderer) {
        return new RelvizService(factParser, styleLoader, dotWriter, graphvizRenderer);
    }
}
