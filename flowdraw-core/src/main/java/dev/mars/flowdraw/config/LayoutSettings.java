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


package dev.mars.flowdraw.config;

/**
 * Geometry used to place node cells in a single left-to-right row.
 *
 * <p>Node {@code i} (zero based) is placed at
 * {@code x = startX + i * spacingX}, {@code y = startY}, with fixed width and height.
 * There is no overlap avoidance and no wrapping.</p>
 *
 * @param nodeWidth  width of every node cell
 * @param nodeHeight height of every node cell
 * @param startX     x of the first node's left edge
 * @param startY     y shared by every node
 * @param spacingX   distance between successive node left edges
 */
public record LayoutSettings(int nodeWidth, int nodeHeight, int startX, int startY, int spacingX) {

    public static final int DEFAULT_NODE_WIDTH = 120;
    public static final int DEFAULT_NODE_HEIGHT = 60;
    public static final int DEFAULT_START_X = 50;
    public static final int DEFAULT_START_Y = 50;
    public static final int DEFAULT_SPACING_X = 150;

    private static final LayoutSettings DEFAULTS = new LayoutSettings(
            DEFAULT_NODE_WIDTH, DEFAULT_NODE_HEIGHT, DEFAULT_START_X, DEFAULT_START_Y, DEFAULT_SPACING_X);

    public LayoutSettings {
        if (nodeWidth <= 0) {
            throw new IllegalArgumentException("nodeWidth must be positive: " + nodeWidth);
        }
        if (nodeHeight <= 0) {
            throw new IllegalArgumentException("nodeHeight must be positive: " + nodeHeight);
        }
        if (spacingX < 0) {
            throw new IllegalArgumentException("spacingX must not be negative: " + spacingX);
        }
    }

    public static LayoutSettings defaults() {
        return DEFAULTS;
    }

    public int xOf(int index) {
        return startX + index * spacingX;
    }
}
