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

import dev.mars.flowdraw.model.FlowEdge;
import dev.mars.flowdraw.model.FlowNode;
import dev.mars.flowdraw.model.FlowchartModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Line-oriented parser for the supported flowchart notation subset.
 *
 * <p>Each line is classified by {@link LineClassifier} and applied to a per-call
 * builder. The first explicit declaration of an id fixes its label and shape; later
 * declarations are ignored. Ids that only occur as edge endpoints become
 * {@link dev.mars.flowdraw.model.NodeShape#DEFAULT default} nodes labelled with their
 * id, appended after the declared nodes in the order they were first seen.</p>
 *
 * <p>The parser holds no mutable state and can be shared between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class MermaidFlowchartParser implements FlowchartParser {

    private static final Logger logger = LoggerFactory.getLogger(MermaidFlowchartParser.class);

    private final LineClassifier classifier;

    public MermaidFlowchartParser() {
        this(new LineClassifier());
    }

    public MermaidFlowchartParser(LineClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    @Override
    public FlowchartModel parse(String text) {
        Objects.requireNonNull(text, "text");

        ModelBuilder builder = new ModelBuilder();
        String[] lines = text.split("\\R", -1);

        for (int i = 0; i < lines.length; i++) {
            LineStatement statement = classifier.classify(lines[i]);
            int lineNumber = i + 1;

            switch (statement.type()) {
                case DIRECTIVE -> logger.trace("Line {}: orientation directive skipped", lineNumber);
                case EDGE -> builder.addEdge((LineStatement.EdgeStatement) statement);
                case NODE -> builder.declare(((LineStatement.NodeDeclaration) statement).node(), lineNumber);
                case UNRECOGNIZED -> {
                    String unrecognized = ((LineStatement.Unrecognized) statement).text();
                    if (!unrecognized.isEmpty()) {
                        logger.debug("Line {}: unrecognized statement skipped: {}", lineNumber, unrecognized);
                    }
                }
            }
        }

        FlowchartModel model = builder.build();
        logger.debug("Parsed flowchart: {} nodes, {} edges", model.getNodes().size(), model.getEdges().size());
        return model;
    }

    /**
     * Accumulates one parse. Declared nodes keep insertion order; seen ids keep
     * first-sight order so implied nodes are emitted deterministically.
     */
    private static final class ModelBuilder {

        private final Map<String, FlowNode> declared = new LinkedHashMap<>();
        private final Set<String> seen = new LinkedHashSet<>();
        private final List<FlowEdge> edges = new ArrayList<>();

        void addEdge(LineStatement.EdgeStatement statement) {
            reference(statement.source());
            reference(statement.target());
            edges.add(new FlowEdge(statement.source().id(), statement.target().id(),
                    statement.label(), statement.kind()));
        }

        void declare(LineStatement.NodeReference node, int lineNumber) {
            if (declared.containsKey(node.id())) {
                logger.trace("Line {}: node '{}' already declared, keeping first declaration",
                        lineNumber, node.id());
            } else {
                declared.put(node.id(), new FlowNode(node.id(), node.label(), node.shape()));
                logger.trace("Line {}: declared node '{}' as {}", lineNumber, node.id(), node.shape().notationName());
            }
            seen.add(node.id());
        }

        private void reference(LineStatement.NodeReference endpoint) {
            if (endpoint.bracketed() && !declared.containsKey(endpoint.id())) {
                declared.put(endpoint.id(), new FlowNode(endpoint.id(), endpoint.label(), endpoint.shape()));
            }
            seen.add(endpoint.id());
        }

        FlowchartModel build() {
            List<FlowNode> nodes = new ArrayList<>(declared.values());
            for (String id : seen) {
                if (!declared.containsKey(id)) {
                    nodes.add(FlowNode.implied(id));
                }
            }
            return new FlowchartModel(nodes, edges);
        }
    }
}
