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
import dev.mars.flowdraw.core.exceptions.ConversionException;
import dev.mars.flowdraw.flowchart.FlowchartConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Converts flowchart notation, given as a file or an inline string, into a draw.io file.
 *
 * <pre>
 *   flowdraw -if diagram.mmd -o diagram.drawio
 *   flowdraw -is "A[Start] --> B{Done?}" -o out.drawio
 * </pre>
 *
 * <p>Exit codes: {@code 0} on success, {@code 1} when the input cannot be read or is
 * empty or the output cannot be written, {@code 2} on invalid usage.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
@Command(
        name = "flowdraw",
        mixinStandardHelpOptions = true,
        version = "flowdraw 1.0.0",
        description = "Convert flowchart notation to draw.io XML."
)
public class FlowdrawCommand implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(FlowdrawCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Spec
    private CommandSpec spec;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private InputOptions input;

    @Option(names = {"-o", "--output_file"}, required = true, paramLabel = "<file>",
            description = "Path for the output .drawio file.")
    private Path outputFile;

    @Option(names = "--indent", description = "Pretty-print the generated XML.")
    private boolean indent;

    private final FlowdrawConfiguration configuration;

    static class InputOptions {
        @Option(names = {"-if", "--input_file"}, paramLabel = "<file>",
                description = "Path to an input file containing flowchart code.")
        Path inputFile;

        @Option(names = {"-is", "--input_string"}, paramLabel = "<text>",
                description = "Flowchart code given directly as a string.")
        String inputString;
    }

    public FlowdrawCommand() {
        this(new FlowdrawConfiguration());
    }

    public FlowdrawCommand(FlowdrawConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    @Override
    public Integer call() {
        try {
            String text = readFlowchart();

            if (indent) {
                configuration.setProperty(FlowdrawConfiguration.OUTPUT_INDENT, "true");
            }
            FlowchartConverter converter = FlowchartConverter.fromConfiguration(configuration);
            FlowchartConverter.ConversionResult result = converter.convertWithReport(text);
            logger.debug("Converted {} nodes and {} edges",
                    result.model().getNodes().size(), result.model().getEdges().size());

            FlowchartFiles.writeDocument(outputFile, result.xml());

            spec.commandLine().getOut().println(
                    "Successfully converted flowchart input to draw.io XML and saved to " + outputFile);
            return EXIT_OK;
        } catch (ConversionException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private String readFlowchart() throws ConversionException {
        if (input.inputFile != null) {
            return FlowchartFiles.requireContent(FlowchartFiles.readInput(input.inputFile), input.inputFile.toString());
        }
        return FlowchartFiles.requireContent(input.inputString, ConversionException.INLINE_ORIGIN);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowdrawCommand()).execute(args);
        System.exit(exitCode);
    }
}
