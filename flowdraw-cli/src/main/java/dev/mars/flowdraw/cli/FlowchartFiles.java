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

import dev.mars.flowdraw.core.exceptions.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads flowchart input and writes generated documents, translating I/O failures into
 * {@link ConversionException}s that name the file involved.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public final class FlowchartFiles {

    private static final Logger logger = LoggerFactory.getLogger(FlowchartFiles.class);

    private FlowchartFiles() {
    }

    public static String readInput(Path inputFile) throws ConversionException {
        try {
            return Files.readString(inputFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ConversionException(inputFile.toString(), "Input file not found", e);
        } catch (IOException e) {
            throw new ConversionException(inputFile.toString(), "Failed to read input file: " + e.getMessage(), e);
        }
    }

    /**
     * Rejects input that holds nothing but whitespace.
     */
    public static String requireContent(String text, String origin) throws ConversionException {
        if (text == null || text.isBlank()) {
            throw new ConversionException(origin, "Flowchart input is empty");
        }
        return text;
    }

    public static void writeDocument(Path outputFile, String xml) throws ConversionException {
        try {
            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(outputFile, xml, StandardCharsets.UTF_8);
            logger.debug("Wrote {} characters to {}", xml.length(), outputFile);
        } catch (IOException e) {
            throw new ConversionException("Error saving file to " + outputFile + ": " + e.getMessage(), e);
        }
    }
}
