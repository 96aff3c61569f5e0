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

import dev.mars.flowdraw.config.FlowdrawConfiguration;
import dev.mars.flowdraw.model.FlowchartModel;

import java.util.Objects;

/**
 * Text to draw.io pipeline: {@link FlowchartParser} then {@link DiagramEmitter}.
 * Stateless; every call builds its own model.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class FlowchartConverter {

    private final FlowchartParser parser;
    private final DiagramEmitter emitter;

    public FlowchartConverter() {
        this(new MermaidFlowchartParser(), new DrawioDiagramEmitter());
    }

    public FlowchartConverter(FlowchartParser parser, DiagramEmitter emitter) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    /**
     * Converter whose emitter takes its layout and indentation from the configuration.
     */
    public static FlowchartConverter fromConfiguration(FlowdrawConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        return new FlowchartConverter(new MermaidFlowchartParser(),
                new DrawioDiagramEmitter(configuration.getLayoutSettings(), configuration.isIndentOutput()));
    }

    public String convert(String text) {
        return emitter.emit(parser.parse(text));
    }

    public ConversionResult convertWithReport(String text) {
        FlowchartModel model = parser.parse(text);
        return new ConversionResult(model, emitter.emitDocument(model));
    }

    /**
     * @param model    parsed graph
     * @param document emitted document and its report
     */
    public record ConversionResult(FlowchartModel model, DiagramDocument document) {

        public ConversionResult {
            Objects.requireNonNull(model, "model");
            Objects.requireNonNull(document, "document");
        }

        public String xml() {
            return document.xml();
        }

        public EmissionReport report() {
            return document.report();
        }
    }
}
