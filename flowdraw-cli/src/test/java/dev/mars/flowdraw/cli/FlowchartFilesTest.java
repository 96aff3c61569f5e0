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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for FlowchartFilesTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */

class FlowchartFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadInput() throws Exception {
        Path input = tempDir.resolve("in.mmd");
        Files.writeString(input, "A --> B\n");

        assertEquals("A --> B\n", FlowchartFiles.readInput(input));
    }

    @Test
    void testReadMissingInput() {
        Path missing = tempDir.resolve("missing.mmd");

        ConversionException e = assertThrows(ConversionException.class, () -> FlowchartFiles.readInput(missing));

        assertEquals(missing.toString(), e.getOrigin());
        assertTrue(e.getMessage().contains("Input file not found"));
    }

    @Test
    void testReadDirectoryFails() {
        ConversionException e = assertThrows(ConversionException.class, () -> FlowchartFiles.readInput(tempDir));

        assertTrue(e.getMessage().contains("Failed to read input file"));
        assertNotNull(e.getCause());
    }

    @Test
    void testRequireContent() throws Exception {
        assertEquals("A", FlowchartFiles.requireContent("A", ConversionException.INLINE_ORIGIN));
        assertThrows(ConversionException.class, () -> FlowchartFiles.requireContent("", "x"));
        assertThrows(ConversionException.class, () -> FlowchartFiles.requireContent(" \n\t", "x"));
        assertThrows(ConversionException.class, () -> FlowchartFiles.requireContent(null, "x"));
    }

    @Test
    void testWriteDocumentOverwrites() throws Exception {
        Path output = tempDir.resolve("out.drawio");
        Files.writeString(output, "old");

        FlowchartFiles.writeDocument(output, "<mxfile/>");

        assertEquals("<mxfile/>", Files.readString(output));
    }
}
