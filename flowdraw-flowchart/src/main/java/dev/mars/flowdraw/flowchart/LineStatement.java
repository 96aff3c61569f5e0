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

import dev.mars.flowdraw.model.EdgeKind;
import dev.mars.flowdraw.model.NodeShape;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of classifying a single flowchart line.
 *
 * <p>Every line maps to exactly one permitted subtype. The parser dispatches on
 * {@link #type()} with a switch covering every type, so ignoring a line is an explicit branch
 * rather than a fallthrough.</p>
 *
 * <h3>Permitted subtypes</h3>
 * <ul>
 *   <li>{@link Directive} - orientation header such as {@code graph TD}; discarded</li>
 *   <li>{@link EdgeStatement} - one of the four connector forms</li>
 *   <li>{@link NodeDeclaration} - a standalone node, bare or bracketed</li>
 *   <li>{@link Unrecognized} - anything else, including blank lines</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public sealed interface LineStatement
        permits LineStatement.Directive,
                LineStatement.EdgeStatement,
                LineStatement.NodeDeclaration,
                LineStatement.Unrecognized {

    enum Type {
        DIRECTIVE, EDGE, NODE, UNRECOGNIZED
    }

    Type type();

    /**
     * A node as written on a line: its id, plus label and shape when brackets were present.
     *
     * @param id       node id
     * @param label    bracket text (trimmed), or the id when there were no brackets
     * @param shape    shape selected by the bracket form, {@link NodeShape#DEFAULT} without brackets
     * @param bracketed whether the node carried a bracket form
     */
    record NodeReference(String id, String label, NodeShape shape, boolean bracketed) {
        public NodeReference {
            Objects.requireNonNull(id, "id");
            label = Optional.ofNullable(label).orElse(id);
            shape = Optional.ofNullable(shape).orElse(NodeShape.DEFAULT);
        }

        public static NodeReference bare(String id) {
            return new NodeReference(id, id, NodeShape.DEFAULT, false);
        }
    }

    record Directive(String text) implements LineStatement {
        @Override
        public Type type() {
            return Type.DIRECTIVE;
        }
    }

    /**
     * @param kind   connector form that matched
     * @param source source endpoint, possibly carrying an inline declaration
     * @param target target endpoint, possibly carrying an inline declaration
     * @param label  trimmed edge label, empty for unlabeled forms
     */
    record EdgeStatement(EdgeKind kind, NodeReference source, NodeReference target, String label)
            implements LineStatement {
        public EdgeStatement {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
            label = Optional.ofNullable(label).orElse("");
        }

        @Override
        public Type type() {
            return Type.EDGE;
        }
    }

    record NodeDeclaration(NodeReference node) implements LineStatement {
        public NodeDeclaration {
            Objects.requireNonNull(node, "node");
        }

        @Override
        public Type type() {
            return Type.NODE;
        }
    }

    record Unrecognized(String text) implements LineStatement {
        @Override
        public Type type() {
            return Type.UNRECOGNIZED;
        }
    }
}
