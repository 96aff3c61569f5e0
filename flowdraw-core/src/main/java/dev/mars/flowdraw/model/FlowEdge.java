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
 * A connection between two node ids.
 *
 * @param source source node id
 * @param target target node id
 * @param label  display text, empty when the connector form carries none
 * @param kind   connector form the edge was written with
 */
public record FlowEdge(String source, String target, String label, EdgeKind kind) {

    public FlowEdge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        label = Optional.ofNullable(label).orElse("");
        kind = Optional.ofNullable(kind).orElse(EdgeKind.ARROW);
    }

    public FlowEdge(String source, String target, String label) {
        this(source, target, label, null);
    }

    public boolean hasLabel() {
        return !label.isEmpty();
    }
}
