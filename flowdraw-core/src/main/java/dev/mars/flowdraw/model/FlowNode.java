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

import java.util.Objects;
import java.util.Optional;

/**
 * A vertex of the flowchart graph.
 *
 * @param id    join key between declarations and edge endpoints
 * @param label display text, the id itself when the node was never declared with brackets
 * @param shape visual shape
 */
public record FlowNode(String id, String label, NodeShape shape) {

    public FlowNode {
        Objects.requireNonNull(id, "id");
        label = Optional.ofNullable(label).orElse(id);
        shape = Optional.ofNullable(shape).orElse(NodeShape.DEFAULT);
    }

    /**
     * Node materialised only because its id appeared as an edge endpoint.
     */
    public static FlowNode implied(String id) {
        return new FlowNode(id, id, NodeShape.DEFAULT);
    }
}
