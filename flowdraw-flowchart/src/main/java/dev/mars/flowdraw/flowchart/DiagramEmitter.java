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

/**
 * Renders a flowchart model into a diagram document.
 */
public interface DiagramEmitter {

    /**
     * @param model parsed flowchart
     * @return document text
     */
    default String emit(FlowchartModel model) {
        return emitDocument(model).xml();
    }

    /**
     * Renders the model and reports any edge that had to be left out.
     *
     * @param model parsed flowchart
     * @return document text with its emission report
     */
    DiagramDocument emitDocument(FlowchartModel model);
}
