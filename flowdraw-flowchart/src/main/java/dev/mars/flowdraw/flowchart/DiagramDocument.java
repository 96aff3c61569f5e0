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


package dev.mars.flowdraw.flowchart;

import java.util.Objects;

/**
 * Serialized diagram together with what was left out of it.
 *
 * @param xml            the mxfile document text
 * @param vertexCount    number of node cells written
 * @param edgeCount      number of edge cells written
 * @param report         skipped-edge warnings
 */
public record DiagramDocument(String xml, int vertexCount, int edgeCount, EmissionReport report) {

    public DiagramDocument {
        Objects.requireNonNull(xml, "xml");
        Objects.requireNonNull(report, "report");
    }

    public int contentCellCount() {
        return vertexCount + edgeCount;
    }
}
