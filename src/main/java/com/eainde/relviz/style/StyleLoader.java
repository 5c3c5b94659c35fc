package com.eainde.relviz.style;

import com.eainde.relviz.fact.Fact;
import com.eainde.relviz.fact.FactParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Supplies the default style sheet.
 *
 * <p>The sheet is read from a Spring resource location ({@code classpath:} or
 * {@code file:}). When it is missing or unreadable a barebone style is used
 * that only declares the usual generalization relation names as edge types.</p>
 */
public class StyleLoader {

    private static final Logger log = LoggerFactory.getLogger(StyleLoader.class);

    public static final String DEFAULT_LOCATION = "classpath:relviz/default.style";

    public static final String BAREBONE_STYLE =
            "edge-type is, are, is-a, is-an, generalizes, subclasses generalization generalization\n";

    private final ResourceLoader resourceLoader;
    private final String location;
    private final FactParser parser;

    public StyleLoader(String location, FactParser parser) {
        this(new DefaultResourceLoader(), location, parser);
    }

    public StyleLoader(ResourceLoader resourceLoader, String location, FactParser parser) {
        this.resourceLoader = resourceLoader;
        this.location = location;
        this.parser = parser;
    }

    /** Text of the default style sheet, falling back to {@link #BAREBONE_STYLE}. */
    public String loadDefaultStyle() {
        Resource resource = resourceLoader.getResource(location);
        if (resource.exists()) {
            try {
                String text = resource.getContentAsString(StandardCharsets.UTF_8);
                log.debug("Loaded {}", location);
                return text + "\n";
            } catch (IOException e) {
                log.warn("Cannot read style sheet {}: {}", location, e.getMessage());
            }
        }
        log.debug("Using barebone default style");
        return BAREBONE_STYLE;
    }

    /**
     * Parsed default style. A fresh list on every call; callers may extend it.
     *
     * @throws com.eainde.relviz.fact.FactSyntaxException if the sheet is malformed
     */
    public List<Fact> defaultStyleFacts() {
        return new ArrayList<>(parser.parse(loadDefaultStyle()));
    }

    public String getLocation() {
        return location;
    }
}
