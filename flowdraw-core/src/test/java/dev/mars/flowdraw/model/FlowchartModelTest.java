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


package dev.mars.flowdraw.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for FlowchartModelTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */

class FlowchartModelTest {

    @Test
    void testNodeDefaultsLabelAndShape() {
        FlowNode node = new FlowNode("A", null, null);

        assertEquals("A", node.id());
        assertEquals("A", node.label());
        assertEquals(NodeShape.DEFAULT, node.shape());
        assertEquals(node, FlowNode.implied("A"));
    }

    @Test
    void testNodeRequiresId() {
        assertThrows(NullPointerException.class, () -> new FlowNode(null, "label", NodeShape.RECTANGLE));
    }

    @Test
    void testEdgeDefaults() {
        FlowEdge edge = new FlowEdge("A", "B", null);

        assertEquals("", edge.label());
        assertFalse(edge.hasLabel());
        assertEquals(EdgeKind.ARROW, edge.kind());
    }

    @Test
    void testEdgeRequiresEndpoints() {
        assertThrows(NullPointerException.class, () -> new FlowEdge(null, "B", ""));
        assertThrows(NullPointerException.class, () -> new FlowEdge("A", null, ""));
    }

    @Test
    void testModelPreservesOrderAndIsImmutable() {
        List<FlowNode> nodes = new ArrayList<>(List.of(
                new FlowNode("B", "Second", NodeShape.RHOMBUS),
                new FlowNode("A", "First", NodeShape.RECTANGLE)));
        List<FlowEdge> edges = new ArrayList<>(List.of(new FlowEdge("A", "B", "go")));

        FlowchartModel model = new FlowchartModel(nodes, edges);
        nodes.clear();

        assertEquals(2, model.getNodes().size());
        assertEquals("B", model.getNodes().get(0).id());
        assertEquals("A", model.getNodes().get(1).id());
        assertThrows(UnsupportedOperationException.class, () -> model.getNodes().add(FlowNode.implied("C")));
        assertThrows(UnsupportedOperationException.class, () -> model.getEdges().clear());
    }

    @Test
    void testModelRejectsNullElements() {
        assertThrows(NullPointerException.class,
                () -> new FlowchartModel(Arrays.asList(FlowNode.implied("A"), null), List.of()));
        assertThrows(NullPointerException.class, () -> new FlowchartModel(null, List.of()));
    }

    @Test
    void testFindNode() {
        FlowchartModel model = new FlowchartModel(
                List.of(new FlowNode("A", "Client", NodeShape.RECTANGLE)), List.of());

        assertTrue(model.containsNode("A"));
        assertFalse(model.containsNode("Z"));
        assertEquals("Client", model.findNode("A").orElseThrow().label());
        assertTrue(model.findNode("Z").isEmpty());
    }

    @Test
    void testEmptyModel() {
        assertTrue(FlowchartModel.empty().isEmpty());
        assertFalse(new FlowchartModel(List.of(FlowNode.implied("A")), List.of()).isEmpty());
        assertEquals(FlowchartModel.empty(), new FlowchartModel(List.of(), List.of()));
    }

    @Test
    void testEdgeKindFlags() {
        assertTrue(EdgeKind.LABELED_ARROW.isLabeled());
        assertTrue(EdgeKind.LABELED_ARROW.hasArrowhead());
        assertTrue(EdgeKind.LABELED_OPEN.isLabeled());
        assertFalse(EdgeKind.LABELED_OPEN.hasArrowhead());
        assertFalse(EdgeKind.ARROW.isLabeled());
        assertTrue(EdgeKind.ARROW.hasArrowhead());
        assertFalse(EdgeKind.OPEN.isLabeled());
        assertFalse(EdgeKind.OPEN.hasArrowhead());
    }

    @Test
    void testShapeNotationNames() {
        assertEquals("rectangle", NodeShape.RECTANGLE.notationName());
        assertEquals("rhombus", NodeShape.RHOMBUS.notationName());
        assertEquals("stadium", NodeShape.STADIUM.notationName());
        assertEquals("default", NodeShape.DEFAULT.notationName());
    }
}
