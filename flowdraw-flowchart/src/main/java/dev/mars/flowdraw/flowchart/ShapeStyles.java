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

import dev.mars.flowdraw.model.NodeShape;

/**
 * draw.io style strings for node shapes and edges.
 */
public final class ShapeStyles {

    public static final String BOX = "rounded=0;whiteSpace=wrap;html=1;";
    public static final String DIAMOND = "shape=rhombus;whiteSpace=wrap;html=1;";
    public static final String ELLIPSE = "shape=ellipse;perimeter=ellipsePerimeter;whiteSpace=wrap;html=1;";

    /** Every edge is drawn arrow-terminated, whatever connector form it was written with. */
    public static final String EDGE = "endArrow=classic;html=1;rounded=0;";

    private ShapeStyles() {
    }

    public static String styleFor(NodeShape shape) {
        if (shape == null) {
            return BOX;
        }
        return switch (shape) {
            case RHOMBUS -> DIAMOND;
            case STADIUM -> ELLIPSE;
            case RECTANGLE, DEFAULT -> BOX;
        };
    }
}
