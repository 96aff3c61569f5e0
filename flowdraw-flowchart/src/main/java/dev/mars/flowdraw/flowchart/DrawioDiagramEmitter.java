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

import dev.mars.flowdraw.config.LayoutSettings;
import dev.mars.flowdraw.core.exceptions.DiagramEmissionException;
import dev.mars.flowdraw.model.FlowEdge;
import dev.mars.flowdraw.model.FlowNode;
import dev.mars.flowdraw.model.FlowchartModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Emits the draw.io {@code mxfile} document for a flowchart model.
 *
 * <p>Cell ids {@code 0} and {@code 1} are the root cell and the default layer. Node cells
 * take ids from {@code 2} upward in model order, then each edge takes the next id in
 * model order. An edge whose endpoint has no node cell still consumes its id but is left
 * out of the document and reported as a warning.</p>
 *
 * <p>Layout is a single row: node {@code i} sits at
 * {@link LayoutSettings#xOf(int) xOf(i)}. Output for a given model and settings is
 * byte-for-byte stable. A new DOM is built per call, so one instance can serve
 * concurrent callers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class DrawioDiagramEmitter implements DiagramEmitter {

    private static final Logger logger = LoggerFactory.getLogger(DrawioDiagramEmitter.class);

    static final String ROOT_CELL_ID = "0";
    static final String LAYER_CELL_ID = "1";
    private static final int FIRST_CONTENT_ID = 2;

    private static final String[][] GRAPH_MODEL_ATTRIBUTES = {
            {"dx", "1000"}, {"dy", "800"}, {"grid", "1"}, {"gridSize", "10"},
            {"guides", "1"}, {"tooltips", "1"}, {"connect", "1"}, {"arrows", "1"},
            {"fold", "1"}, {"page", "1"}, {"pageScale", "1"},
            {"pageWidth", "850"}, {"pageHeight", "1100"}, {"math", "0"}, {"shadow", "0"}
    };

    private final LayoutSettings layout;
    private final boolean indent;

    public DrawioDiagramEmitter() {
        this(LayoutSettings.defaults(), false);
    }

    public DrawioDiagramEmitter(LayoutSettings layout, boolean indent) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.indent = indent;
    }

    @Override
    public DiagramDocument emitDocument(FlowchartModel model) {
        Objects.requireNonNull(model, "model");

        Document doc = newDocument();
        Element root = createSkeleton(doc);
        EmissionReport report = new EmissionReport();

        int nextId = FIRST_CONTENT_ID;
        Map<String, String> cellIds = new HashMap<>();

        List<FlowNode> nodes = model.getNodes();
        for (int i = 0; i < nodes.size(); i++) {
            FlowNode node = nodes.get(i);
            String cellId = String.valueOf(nextId++);
            // first cell wins if a hand-built model repeats an id
            cellIds.putIfAbsent(node.id(), cellId);
            root.appendChild(vertexCell(doc, cellId, node, i));
        }

        int edgeCount = 0;
        List<FlowEdge> edges = model.getEdges();
        for (int i = 0; i < edges.size(); i++) {
            FlowEdge edge = edges.get(i);
            String cellId = String.valueOf(nextId++);
            String sourceId = cellIds.get(edge.source());
            String targetId = cellIds.get(edge.target());

            if (sourceId == null || targetId == null) {
                String missing = sourceId == null ? edge.source() : edge.target();
                logger.warn("Skipping edge {} ({} -> {}): no node cell for '{}'",
                        i, edge.source(), edge.target(), missing);
                report.addSkippedEdge(i, edge, "No node cell for endpoint '" + missing + "'");
                continue;
            }

            root.appendChild(edgeCell(doc, cellId, edge, sourceId, targetId));
            edgeCount++;
        }

        return new DiagramDocument(serialize(doc), nodes.size(), edgeCount, report);
    }

    private Element createSkeleton(Document doc) {
        Element mxfile = doc.createElement("mxfile");
        mxfile.setAttribute("compressed", "false");
        mxfile.setAttribute("host", "app.diagrams.net");
        doc.appendChild(mxfile);

        Element diagram = doc.createElement("diagram");
        diagram.setAttribute("id", "Diagram1");
        diagram.setAttribute("name", "Page-1");
        mxfile.appendChild(diagram);

        Element graphModel = doc.createElement("mxGraphModel");
        for (String[] attribute : GRAPH_MODEL_ATTRIBUTES) {
            graphModel.setAttribute(attribute[0], attribute[1]);
        }
        diagram.appendChild(graphModel);

        Element root = doc.createElement("root");
        graphModel.appendChild(root);

        Element rootCell = doc.createElement("mxCell");
        rootCell.setAttribute("id", ROOT_CELL_ID);
        root.appendChild(rootCell);

        Element layerCell = doc.createElement("mxCell");
        layerCell.setAttribute("id", LAYER_CELL_ID);
        layerCell.setAttribute("parent", ROOT_CELL_ID);
        root.appendChild(layerCell);

        return root;
    }

    private Element vertexCell(Document doc, String cellId, FlowNode node, int index) {
        Element cell = doc.createElement("mxCell");
        cell.setAttribute("id", cellId);
        cell.setAttribute("value", node.label());
        cell.setAttribute("style", ShapeStyles.styleFor(node.shape()));
        cell.setAttribute("parent", LAYER_CELL_ID);
        cell.setAttribute("vertex", "1");

        Element geometry = doc.createElement("mxGeometry");
        geometry.setAttribute("x", String.valueOf(layout.xOf(index)));
        geometry.setAttribute("y", String.valueOf(layout.startY()));
        geometry.setAttribute("width", String.valueOf(layout.nodeWidth()));
        geometry.setAttribute("height", String.valueOf(layout.nodeHeight()));
        geometry.setAttribute("as", "geometry");
        cell.appendChild(geometry);

        return cell;
    }

    private Element edgeCell(Document doc, String cellId, FlowEdge edge, String sourceId, String targetId) {
        Element cell = doc.createElement("mxCell");
        cell.setAttribute("id", cellId);
        cell.setAttribute("value", edge.label());
        cell.setAttribute("style", ShapeStyles.EDGE);
        cell.setAttribute("parent", LAYER_CELL_ID);
        cell.setAttribute("edge", "1");
        cell.setAttribute("source", sourceId);
        cell.setAttribute("target", targetId);

        Element geometry = doc.createElement("mxGeometry");
        geometry.setAttribute("relative", "1");
        geometry.setAttribute("as", "geometry");
        cell.appendChild(geometry);

        return cell;
    }

    private Document newDocument() {
        try {
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
        } catch (ParserConfigurationException e) {
            throw new DiagramEmissionException("Unable to create XML document builder", e);
        }
    }

    private String serialize(Document doc) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            if (indent) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            }

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException e) {
            throw new DiagramEmissionException("Unable to serialize diagram document", e);
        }
    }
}
