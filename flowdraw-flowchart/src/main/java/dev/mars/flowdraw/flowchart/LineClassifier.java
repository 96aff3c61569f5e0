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

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies one trimmed line of flowchart notation.
 *
 * <p>Edge forms are tried most specific first and the first match wins:</p>
 * <ol>
 *   <li>{@code A -- label --> B}</li>
 *   <li>{@code A -- label -- B}</li>
 *   <li>{@code A --> B}</li>
 *   <li>{@code A --- B}</li>
 * </ol>
 * <p>Only when no edge form matches is the line tried as a node declaration.
 * Edge endpoints may carry the same bracket forms as a declaration
 * ({@code A[Client] --> B{Decision}}). A trailing {@code ;} is accepted on both.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */
public class LineClassifier {

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    // an endpoint body stops at its first closing delimiter so it cannot run into the connector
    private static final String SHAPE = "(?:\\[[^\\]]*\\]|\\{[^}]*\\}|\\(\\([^)]*\\)\\)|\\([^)]*\\))";
    // a declaration body runs to the last closing delimiter on the line
    private static final String DECLARED_SHAPE = "(?:\\[.*?\\]|\\{.*?\\}|\\(\\(.*?\\)\\)|\\(.*?\\))";
    private static final String ENDPOINT = "(\\w+" + SHAPE + "?)";
    private static final String END = "\\s*;?$";
    // a label must contain something other than dashes and may not open with an arrow
    private static final String LABEL = "(-*[^\\s>-].*?)";

    private static final Pattern LABELED_ARROW = Pattern.compile(
            "^" + ENDPOINT + "\\s*-{2,}\\s*" + LABEL + "\\s*-{2,}>\\s*" + ENDPOINT + END, FLAGS);
    private static final Pattern LABELED_OPEN = Pattern.compile(
            "^" + ENDPOINT + "\\s*-{2,}\\s*" + LABEL + "\\s*-{2,}\\s*" + ENDPOINT + END, FLAGS);
    private static final Pattern ARROW = Pattern.compile(
            "^" + ENDPOINT + "\\s*-{2,}>\\s*" + ENDPOINT + END, FLAGS);
    private static final Pattern OPEN = Pattern.compile(
            "^" + ENDPOINT + "\\s*-{3,}\\s*" + ENDPOINT + END, FLAGS);

    private static final Pattern DECLARATION = Pattern.compile("^(\\w+" + DECLARED_SHAPE + "?)" + END, FLAGS);

    // groups: 1 id, 2 rectangle, 3 rhombus, 4 double-paren stadium, 5 stadium
    private static final Pattern NODE_TOKEN = Pattern.compile(
            "^(\\w+)(?:\\[(.*?)\\]|\\{(.*?)\\}|\\(\\((.*?)\\)\\)|\\((.*?)\\))?$", FLAGS);

    private static final String[] DIRECTIVE_KEYWORDS = {"graph", "flowchart"};

    public LineStatement classify(String rawLine) {
        String line = rawLine == null ? "" : rawLine.trim();

        if (line.isEmpty()) {
            return new LineStatement.Unrecognized(line);
        }
        if (isDirective(line)) {
            return new LineStatement.Directive(line);
        }

        LineStatement edge = matchEdge(line);
        if (edge != null) {
            return edge;
        }

        Matcher declaration = DECLARATION.matcher(line);
        if (declaration.matches()) {
            return new LineStatement.NodeDeclaration(parseNodeToken(declaration.group(1)));
        }

        return new LineStatement.Unrecognized(line);
    }

    private boolean isDirective(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String keyword : DIRECTIVE_KEYWORDS) {
            if (lower.startsWith(keyword)) {
                return true;
            }
        }
        return false;
    }

    private LineStatement matchEdge(String line) {
        Matcher m = LABELED_ARROW.matcher(line);
        if (m.matches()) {
            return labeled(EdgeKind.LABELED_ARROW, m);
        }
        m = LABELED_OPEN.matcher(line);
        if (m.matches()) {
            return labeled(EdgeKind.LABELED_OPEN, m);
        }
        m = ARROW.matcher(line);
        if (m.matches()) {
            return unlabeled(EdgeKind.ARROW, m);
        }
        m = OPEN.matcher(line);
        if (m.matches()) {
            return unlabeled(EdgeKind.OPEN, m);
        }
        return null;
    }

    private LineStatement labeled(EdgeKind kind, Matcher m) {
        return new LineStatement.EdgeStatement(kind,
                parseNodeToken(m.group(1)), parseNodeToken(m.group(3)), m.group(2).trim());
    }

    private LineStatement unlabeled(EdgeKind kind, Matcher m) {
        return new LineStatement.EdgeStatement(kind,
                parseNodeToken(m.group(1)), parseNodeToken(m.group(2)), "");
    }

    /**
     * Splits an endpoint token such as {@code B{Decision}} into id, label and shape.
     * Tokens reaching here already matched an endpoint or a declaration.
     */
    static LineStatement.NodeReference parseNodeToken(String token) {
        Matcher m = NODE_TOKEN.matcher(token);
        if (!m.matches()) {
            throw new IllegalStateException("Not a node token: " + token);
        }

        String id = m.group(1);
        if (m.group(2) != null) {
            return new LineStatement.NodeReference(id, m.group(2).trim(), NodeShape.RECTANGLE, true);
        }
        if (m.group(3) != null) {
            return new LineStatement.NodeReference(id, m.group(3).trim(), NodeShape.RHOMBUS, true);
        }
        if (m.group(4) != null) {
            return new LineStatement.NodeReference(id, m.group(4).trim(), NodeShape.STADIUM, true);
        }
        if (m.group(5) != null) {
            return new LineStatement.NodeReference(id, m.group(5).trim(), NodeShape.STADIUM, true);
        }
        return LineStatement.NodeReference.bare(id);
    }
}
