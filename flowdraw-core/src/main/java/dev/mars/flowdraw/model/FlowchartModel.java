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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Normalized flowchart graph: ordered nodes and ordered edges, immutable once built.
 *
 * <p>The model does not enforce that every edge endpoint has a node. The parser
 * guarantees it; a hand-built model may break it, and the emitter copes by
 * skipping the offending edge.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public final class FlowchartModel {

    private static final FlowchartModel EMPTY = new FlowchartModel(List.of(), List.of());

    private final List<FlowNode> nodes;
    private final List<FlowEdge> edges;

    public FlowchartModel(List<FlowNode> nodes, List<FlowEdge> edges) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        // List.copyOf rejects null elements
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public static FlowchartModel empty() {
        return EMPTY;
    }

    public List<FlowNode> getNodes() {
        return nodes;
    }

    public List<FlowEdge> getEdges() {
        return edges;
    }

    public Optional<FlowNode> findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public boolean containsNode(String id) {
        return findNode(id).isPresent();
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlowchartModel that = (FlowchartModel) o;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "FlowchartModel{" +
               "nodes=" + nodes.size() +
               ", edges=" + edges.size() +
               '}';
    }
}
