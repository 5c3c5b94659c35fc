package com.eainde.relviz.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Renders DOT text to an image by running a Graphviz layout program.
 *
 * <h3>Process handling</h3>
 * <ul>
 *   <li>One child process per call: {@code <executable> -T<format>}.</li>
 *   <li>DOT text goes to its standard input; standard output and error are
 *       drained concurrently on {@code streamExecutor} so neither pipe can
 *       fill up and block the program.</li>
 *   <li>The call waits at most {@code timeout}; whatever happens the process
 *       is destroyed before returning.</li>
 *   <li>A non-zero exit status fails with the program's error text. There are
 *       no retries.</li>
 * </ul>
 */
public class GraphvizRenderer {

    private static final Logger log = LoggerFactory.getLogger(GraphvizRenderer.class);

    private final Map<LayoutEngine, String> executables;
    private final Duration timeout;
    private final Executor streamExecutor;

    public GraphvizRenderer(Map<LayoutEngine, String> executables, Duration timeout, Executor streamExecutor) {
        this.executables = executables.isEmpty() ? Map.of() : new EnumMap<>(executables);
        this.timeout = timeout;
        this.streamExecutor = streamExecutor;
    }

    /**
     * @param dot    graph description in DOT
     * @param engine layout program to run
     * @param format Graphviz output format, for example {@code svg} or {@code png}
     * @return the program's standard output
     * @throws UnknownProcessorException if no executable is configured for {@code engine}
     * @throws RenderException           if the program cannot be run, times out or fails
     */
    public byte[] render(String dot, LayoutEngine engine, String format) {
        String executable = executables.get(engine);
        if (executable == null || executable.isBlank()) {
            throw new UnknownProcessorException(engine.processor());
        }
        List<String> command = List.of(executable, "-T" + format);
        log.debug("Starting layout process: {}", command);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new RenderException("Cannot start " + executable + ": " + e.getMessage(), e);
        }

        try {
            CompletableFuture<byte[]> stdout = drain(process.getInputStream());
            CompletableFuture<byte[]> stderr = drain(process.getErrorStream());

            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(dot.getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                // the program may exit before reading everything; its exit status tells the story
                log.debug("Layout process closed its input early: {}", e.getMessage());
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RenderException(executable + " did not finish within "
                        + timeout.toSeconds() + " seconds", RenderException.NO_EXIT_CODE);
            }
            int exitCode = process.exitValue();
            byte[] output = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String errors = new String(stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS),
                    StandardCharsets.UTF_8);

            if (exitCode != 0) {
                log.warn("{} exited with status {}", executable, exitCode);
                throw new RenderException(errors.isBlank()
                        ? executable + " exited with status " + exitCode
                        : errors, exitCode);
            }
            if (!errors.isBlank()) {
                log.warn("{} reported: {}", executable, errors.strip());
            }
            log.debug("Layout process produced {} bytes of {}", output.length, format);
            return output;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while waiting for " + executable, e);
        } catch (ExecutionException e) {
            throw new RenderException("Failed to read output of " + executable, e.getCause());
        } catch (TimeoutException e) {
            throw new RenderException("Timed out reading output of " + executable, e);
        } finally {
            process.destroy();
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private CompletableFuture<byte[]> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return in.readAllBytes();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamExecutor);
    }
}
