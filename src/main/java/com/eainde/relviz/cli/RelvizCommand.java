package com.eainde.relviz.cli;

import ch.qos.logback.classic.Level;
import com.eainde.relviz.RelvizException;
import com.eainde.relviz.diagnostics.LoggingDiagnosticSink;
import com.eainde.relviz.fact.FactParser;
import com.eainde.relviz.render.DotWriter;
import com.eainde.relviz.render.GraphvizRenderer;
import com.eainde.relviz.render.LayoutEngine;
import com.eainde.relviz.render.RenderException;
import com.eainde.relviz.render.UnknownProcessorException;
import com.eainde.relviz.service.DiagramRequest;
import com.eainde.relviz.service.RelvizService;
import com.eainde.relviz.style.StyleLoader;
import com.eainde.relviz.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Renders facts as a Graphviz graph from the command line.
 *
 * <pre>
 *   relviz model.facts                       DOT to stdout, default style
 *   relviz -s uml.style -o model.dot model.facts
 *   relviz --no-default-style -s my.style model.facts
 *   relviz -e dot -T png -o model.png model.facts
 *   cat model.facts | relviz -v
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 when the facts or style are rejected, 2 when
 * a file cannot be read or written, the engine is unknown or the layout
 * engine fails.</p>
 */
@Slf4j
@Command(
        name = "relviz",
        mixinStandardHelpOptions = true,
        version = "relviz 1.0.0",
        description = "Render facts as a GraphViz graph."
)
public class RelvizCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_FAILED = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", paramLabel = "<facts>",
            description = "Facts file [stdin]")
    private Path facts;

    @Option(names = {"-s", "--style"}, paramLabel = "<file>", description = "Style file [none]")
    private Path style;

    @Option(names = "--default-style", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Use the default style [default: true]")
    private boolean defaultStyle;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file [stdout]")
    private Path output;

    @Option(names = {"-v", "--verbose"}, description = "Produce debugging output")
    private boolean verbose;

    @Option(names = {"-e", "--engine"}, paramLabel = "<engine>",
            description = "Render through a layout engine (dot, fdp) instead of writing DOT")
    private String engine;

    @Option(names = {"-T", "--format"}, paramLabel = "<format>", defaultValue = "svg",
            description = "Output format when rendering [default: svg]")
    private String format;

    @Option(names = "--executable", paramLabel = "<path>",
            description = "Layout program to run [/usr/bin/<engine>]")
    private String executable;

    @Option(names = "--timeout", paramLabel = "<seconds>", defaultValue = "30",
            description = "Layout timeout in seconds [default: 30]")
    private long timeoutSeconds;

    private final InputStream stdin;
    private final OutputStream stdout;

    public RelvizCommand() {
        this(System.in, System.out);
    }

    RelvizCommand(InputStream stdin, OutputStream stdout) {
        this.stdin = stdin;
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new RelvizCommand()).execute(args));
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.eainde.relviz")).setLevel(Level.DEBUG);
        }
        try (MdcAwareExecutor streamExecutor = new MdcAwareExecutor("relviz-cli-io-")) {
            LayoutEngine layoutEngine = engine == null ? null : LayoutEngine.fromProcessor(engine);
            RelvizService service = service(layoutEngine, streamExecutor);

            String styleText = style == null ? null : Files.readString(style, StandardCharsets.UTF_8);
            DiagramRequest request = new DiagramRequest(readFacts(), styleText, defaultStyle, false);
            LoggingDiagnosticSink diagnostics = new LoggingDiagnosticSink(log);

            byte[] result = layoutEngine == null
                    ? service.toDot(request, diagnostics).getBytes(StandardCharsets.UTF_8)
                    : service.render(request, layoutEngine, format, diagnostics);
            write(result);
            return EXIT_OK;
        } catch (RenderException | UnknownProcessorException e) {
            spec.commandLine().getErr().println("relviz: " + e.getMessage());
            return EXIT_FAILED;
        } catch (RelvizException e) {
            spec.commandLine().getErr().println("relviz: " + e.getMessage());
            return EXIT_REJECTED;
        } catch (IOException e) {
            spec.commandLine().getErr().println("relviz: " + e);
            return EXIT_FAILED;
        }
    }

    private RelvizService service(LayoutEngine layoutEngine, MdcAwareExecutor streamExecutor) {
        FactParser parser = new FactParser();
        Map<LayoutEngine, String> executables = layoutEngine == null
                ? Map.of()
                : Map.of(layoutEngine, executable != null ? executable : "/usr/bin/" + layoutEngine.processor());
        GraphvizRenderer renderer = new GraphvizRenderer(executables, Duration.ofSeconds(timeoutSeconds), streamExecutor);
        return new RelvizService(parser, new StyleLoader(StyleLoader.DEFAULT_LOCATION, parser),
                new DotWriter(), renderer);
    }

    private String readFacts() throws IOException {
        if (facts == null) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(facts, StandardCharsets.UTF_8);
    }

    private void write(byte[] result) throws IOException {
        if (output == null) {
            stdout.write(result);
            stdout.flush();
        } else {
            Files.write(output, result);
            log.debug("Wrote {} bytes to {}", result.length, output);
        }
    }
}
