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

import java.util.Locale;

/**
 * Visual shape of a flowchart node, as selected by the bracket form of its declaration.
 *
 * <ul>
 *   <li>{@code A[text]} - {@link #RECTANGLE}</li>
 *   <li>{@code A{text}} - {@link #RHOMBUS}</li>
 *   <li>{@code A(text)} or {@code A((text))} - {@link #STADIUM}</li>
 *   <li>bare {@code A} or an id only seen as an edge endpoint - {@link #DEFAULT}</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public enum NodeShape {
    RECTANGLE,
    RHOMBUS,
    STADIUM,
    DEFAULT;

    /**
     * Lower-case name used in diagnostics and in the notation documentation.
     */
    public String notationName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
