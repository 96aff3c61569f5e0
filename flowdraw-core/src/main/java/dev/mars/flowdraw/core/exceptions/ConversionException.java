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


package dev.mars.flowdraw.core.exceptions;

/**
 * Exception thrown when a conversion run cannot proceed: the flowchart input cannot be
 * read, is empty, or the generated document cannot be written.
 *
 * <p>The parser and emitter never throw this; it belongs to the layer that moves text
 * in and out of files.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class ConversionException extends FlowdrawException {

    /** Origin used for input passed directly as a string. */
    public static final String INLINE_ORIGIN = "<inline>";

    private final String origin;

    public ConversionException(String message) {
        super(message);
        this.origin = null;
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
        this.origin = null;
    }

    public ConversionException(String origin, String message) {
        super(message);
        this.origin = origin;
    }

    public ConversionException(String origin, String message, Throwable cause) {
        super(message, cause);
        this.origin = origin;
    }

    /**
     * File path or {@link #INLINE_ORIGIN} the failure relates to, or null when unknown.
     */
    public String getOrigin() {
        return origin;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();

        if (origin != null) {
            sb.append("Input '").append(origin).append("': ");
        }

        sb.append(super.getMessage());

        return sb.toString();
    }
}
