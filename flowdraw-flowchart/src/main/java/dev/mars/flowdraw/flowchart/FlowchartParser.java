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

import dev.mars.flowdraw.model.FlowchartModel;

public interface FlowchartParser {

    /**
     * Parses flowchart notation into a normalized graph model.
     * Never fails: lines that are not recognised are skipped.
     *
     * @param text multi-line flowchart text
     * @return ordered nodes and edges; every edge endpoint has exactly one node
     */
    FlowchartModel parse(String text);
}
