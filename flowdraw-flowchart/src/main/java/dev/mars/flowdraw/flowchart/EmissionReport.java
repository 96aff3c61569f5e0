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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Non-fatal problems found while emitting a diagram. Currently the only kind is an
 * edge whose endpoint has no node cell; such an edge is left out of the document.
 */
public class EmissionReport {

    private final List<EmissionIssue> warnings;

    public EmissionReport() {
        this.warnings = new ArrayList<>();
    }

    public void addSkippedEdge(int edgeIndex, FlowEdge edge, String message) {
        warnings.add(new EmissionIssue(edgeIndex, edge, message));
    }

    public List<EmissionIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    @Override
    public String toString() {
        return "EmissionReport{warnings=" + warnings.size() + "}";
    }

    /**
     * A single skipped edge.
     */
    public static class EmissionIssue {

        private final int edgeIndex;
        private final FlowEdge edge;
        private final String message;

        public EmissionIssue(int edgeIndex, FlowEdge edge, String message) {
            this.edgeIndex = edgeIndex;
            this.edge = Objects.requireNonNull(edge, "Edge cannot be null");
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        /**
         * Zero-based position of the edge in the model's edge list.
         */
        public int getEdgeIndex() {
            return edgeIndex;
        }

        public FlowEdge getEdge() {
            return edge;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            EmissionIssue that = (EmissionIssue) o;
            return edgeIndex == that.edgeIndex &&
                   edge.equals(that.edge) &&
                   message.equals(that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(edgeIndex, edge, message);
        }

        @Override
        public String toString() {
            return "WARNING (edge " + edgeIndex + ") [" + edge.source() + " -> " + edge.target() + "]: " + message;
        }
    }
}
