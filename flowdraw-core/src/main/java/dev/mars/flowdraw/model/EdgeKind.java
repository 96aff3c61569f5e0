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

/**
 * The four connector forms recognised on an edge line, in matching priority order.
 *
 * <p>The kind is kept on the model for inspection; the draw.io emitter renders every
 * kind with the same arrow-terminated style.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum EdgeKind {
    /** {@code A -- label --> B} */
    LABELED_ARROW(true, true),
    /** {@code A -- label -- B} */
    LABELED_OPEN(true, false),
    /** {@code A --> B} */
    ARROW(false, true),
    /** {@code A --- B} */
    OPEN(false, false);

    private final boolean labeled;
    private final boolean arrowhead;

    EdgeKind(boolean labeled, boolean arrowhead) {
        this.labeled = labeled;
        this.arrowhead = arrowhead;
    }

    public boolean isLabeled() {
        return labeled;
    }

    public boolean hasArrowhead() {
        return arrowhead;
    }
}
