/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.flowdraw.cli;

import dev.mars.flowdraw.config.FlowdrawConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FlowdrawCommand Tests")
class FlowdrawCommandTest {

    private static final String FLOWCHART = """
            graph TD
            A[Client] --> B{Decision}
            B -- yes --> C[Server]
            """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new FlowdrawCommand(new FlowdrawConfiguration(new Properties())));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    private int run(String... args) {
        return commandLine.execute(args);
    }

    @Nested
    @DisplayName("Successful conversions")
    class Success {

        @Test
        @DisplayName("Should convert an input file")
        void convertsFile() throws Exception {
            Path input = tempDir.resolve("diagram.mmd");
            Files.writeString(input, FLOWCHART, StandardCharsets.UTF_8);
            Path output = tempDir.resolve("diagram.drawio");

            int exitCode = run("-if", input.toString(), "-o", output.toString());

            assertThat(exitCode).isEqualTo(0);
            String xml = Files.readString(output, StandardCharsets.UTF_8);
            assertThat(xml).startsWith("<mxfile");
            assertThat(xml).contains("value=\"Client\"", "value=\"Decision\"", "value=\"yes\"");
            assertThat(out.toString()).contains("Successfully converted").contains(output.toString());
            assertThat(err.toString()).isEmpty();
        }

        @Test
        @DisplayName("Should convert an inline string using long option names")
        void convertsInlineString() throws Exception {
            Path output = tempDir.resolve("inline.drawio");

            int exitCode = run("--input_string", "A --> B", "--output_file", output.toString());

            assertThat(exitCode).isEqualTo(0);
            assertThat(Files.readString(output)).contains("source=\"2\"", "target=\"3\"");
        }

        @Test
        @DisplayName("Should create missing output directories")
        void createsParentDirectories() {
            Path output = tempDir.resolve("nested/deeper/out.drawio");

            int exitCode = run("-is", FLOWCHART, "-o", output.toString());

            assertThat(exitCode).isEqualTo(0);
            assertThat(output).exists();
        }

        @Test
        @DisplayName("Indent flag pretty-prints the document")
        void indentFlag() throws Exception {
            Path output = tempDir.resolve("pretty.drawio");

            run("-is", FLOWCHART, "-o", output.toString(), "--indent");

            assertThat(Files.readString(output)).contains("\n");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Missing input file exits with 1 and names the file")
        void missingInputFile() {
            Path missing = tempDir.resolve("absent.mmd");
            Path output = tempDir.resolve("out.drawio");

            int exitCode = run("-if", missing.toString(), "-o", output.toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString()).contains("Input file not found").contains("absent.mmd");
            assertThat(output).doesNotExist();
        }

        @Test
        @DisplayName("Blank inline input exits with 1")
        void emptyInlineInput() {
            int exitCode = run("-is", "   ", "-o", tempDir.resolve("out.drawio").toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString()).contains("Flowchart input is empty").contains("<inline>");
        }

        @Test
        @DisplayName("Empty input file exits with 1")
        void emptyInputFile() throws Exception {
            Path input = tempDir.resolve("empty.mmd");
            Files.writeString(input, "\n\n");

            int exitCode = run("-if", input.toString(), "-o", tempDir.resolve("out.drawio").toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString()).contains("Flowchart input is empty");
        }

        @Test
        @DisplayName("Unwritable output exits with 1")
        void unwritableOutput() throws Exception {
            Path blocker = tempDir.resolve("blocker");
            Files.writeString(blocker, "a file, not a directory");

            int exitCode = run("-is", FLOWCHART, "-o", blocker.resolve("out.drawio").toString());

            assertThat(exitCode).isEqualTo(1);
            assertThat(err.toString()).contains("Error saving file to");
        }
    }

    @Nested
    @DisplayName("Usage errors")
    class Usage {

        @Test
        @DisplayName("Input file and input string are mutually exclusive")
        void mutuallyExclusiveInputs() {
            int exitCode = run("-if", "a.mmd", "-is", "A --> B", "-o", "out.drawio");

            assertThat(exitCode).isEqualTo(2);
            assertThat(err.toString()).contains("mutually exclusive");
        }

        @Test
        @DisplayName("One input is required")
        void inputRequired() {
            int exitCode = run("-o", tempDir.resolve("out.drawio").toString());

            assertThat(exitCode).isEqualTo(2);
            assertThat(err.toString()).contains("Missing required");
        }

        @Test
        @DisplayName("Output file is required")
        void outputRequired() {
            int exitCode = run("-is", "A --> B");

            assertThat(exitCode).isEqualTo(2);
            assertThat(err.toString()).contains("--output_file");
        }
    }
}
