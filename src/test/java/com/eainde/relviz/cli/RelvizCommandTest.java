package com.eainde.relviz.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RelvizCommandTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final StringWriter stderr = new StringWriter();

    private int run(String stdin, String... args) {
        RelvizCommand command = new RelvizCommand(
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)), stdout);
        CommandLine commandLine = new CommandLine(command);
        commandLine.setErr(new PrintWriter(stderr, true));
        return commandLine.execute(args);
    }

    private Path file(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, content);
        return path;
    }

    private String output() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    // =========================================================================
    //  DOT output
    // =========================================================================

    @Nested
    @DisplayName("Writing DOT")
    class Dot {

        @Test
        @DisplayName("should write DOT for a facts file to stdout")
        void factsFile() throws IOException {
            Path facts = file("model.facts", "class Car\npackage Vehicles\nCar in Vehicles");

            int exitCode = run("", facts.toString());

            assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_OK);
            assertThat(output()).startsWith("digraph {")
                    .contains("\"Car\" [\"shape\"=\"box\"]", "subgraph \"clusterVehicles\"");
        }

        @Test
        @DisplayName("should read facts from stdin when no file is given")
        void stdin() {
            int exitCode = run("class Car\n");

            assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_OK);
            assertThat(output()).contains("\"Car\"");
        }

        @Test
        @DisplayName("should use only the given style without the default one")
        void customStyleOnly() throws IOException {
            Path style = file("my.style", "node-type widget\ndefaults widget\n  shape: hexagon");
            Path facts = file("model.facts", "widget W\nclass C\n");

            int exitCode = run("", "--no-default-style", "-s", style.toString(), facts.toString());

            assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_OK);
            assertThat(output()).contains("\"W\" [\"shape\"=\"hexagon\"]").doesNotContain("\"C\"");
        }

        @Test
        @DisplayName("should write to the output file when one is given")
        void outputFile() throws IOException {
            Path facts = file("model.facts", "class Car\n");
            Path out = dir.resolve("model.dot");

            int exitCode = run("", "-o", out.toString(), facts.toString());

            assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_OK);
            assertThat(output()).isEmpty();
            assertThat(Files.readString(out)).contains("\"Car\"");
        }
    }

    // =========================================================================
    //  Failures
    // =========================================================================

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should exit with 1 and explain rejected facts")
        void rejectedFacts() {
            int exitCode = run("package P, Q\nP in Q\nQ in P\n");

            assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_REJECTED);
            assertThat(stderr.toString()).contains("Circular containment: P in Q in P");
        }

        @Test
        @DisplayName("should exit with 1 on a syntax error")
        void syntaxError() {
            int exitCode = run("class \"broken\n");

            assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_REJECTED);
            assertThat(stderr.toString()).contains("Expected");
        }

        @Test
        @DisplayName("should exit with 2 when the facts file is missing")
        void missingFile() {
            int exitCode = run("", dir.resolve("nope.facts").toString());

            assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_FAILED);
            assertThat(stderr.toString()).contains("nope.facts");
        }

        @Test
        @DisplayName("should exit with 2 for an unknown engine")
        void unknownEngine() {
            int exitCode = run("class Car\n", "-e", "neato");

            assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_FAILED);
            assertThat(stderr.toString()).contains("Unsupported processor: neato");
        }
    }

    // =========================================================================
    //  Rendering
    // =========================================================================

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should render through the given layout program")
    void rendersThroughEngine() throws IOException {
        Path program = file("fake-dot", "#!/bin/sh\ncat > /dev/null\nprintf '<svg format=\"%s\"/>' \"$1\"\n");
        assertThat(program.toFile().setExecutable(true)).isTrue();

        int exitCode = run("class Car\n", "-e", "dot", "--executable", program.toString(), "-T", "svg");

        assertThat(exitCode).isEqualTo(RelvizCommand.EXIT_OK);
        assertThat(output()).isEqualTo("<svg format=\"-Tsvg\"/>");
    }
}
