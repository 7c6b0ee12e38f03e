package org.dxworks.fortframe.analyzer.reader;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites fixed-form source into free form, one physical line at a time.
 * <p>
 * Comments and blank lines between a statement and its continuation are kept in place; the marker that ends
 * the statement is added once the continuation line is seen.
 */
public final class FixedFormConverter {

    private static final int LABEL_END = 5;
    private static final int CODE_START = 6;
    private static final int LINE_LIMIT = 72;

    private FixedFormConverter() {
    }

    public static String toFreeForm(String text, boolean lengthLimit) {
        String[] lines = text.split("\r?\n", -1);
        List<FixedLine> stack = new ArrayList<>();
        List<String> out = new ArrayList<>();
        for (String raw : lines) {
            FixedLine line = FixedLine.parse(raw, lengthLimit);
            if (line.regular) {
                if (line.continuation && !stack.isEmpty()) {
                    stack.get(0).continued = true;
                }
                flush(stack, out);
            }
            stack.add(line);
        }
        flush(stack, out);
        return String.join("\n", out);
    }

    private static void flush(List<FixedLine> stack, List<String> out) {
        for (FixedLine line : stack) {
            out.add(line.render());
        }
        stack.clear();
    }

    private static final class FixedLine {
        private boolean regular;
        private boolean continuation;
        private boolean continued;
        private String label = "";
        private String code = "";
        private String comment = "";
        private String verbatim;

        static FixedLine parse(String raw, boolean lengthLimit) {
            FixedLine line = new FixedLine();
            if (raw.isBlank()) {
                line.verbatim = "";
                return line;
            }
            char first = raw.charAt(0);
            if (first == 'c' || first == 'C' || first == '*' || first == '!') {
                line.verbatim = "!" + raw.substring(1);
                return line;
            }
            if (raw.stripLeading().startsWith("#")) {
                line.verbatim = raw;
                return line;
            }
            if (first == '\t') {
                String rest = raw.substring(1);
                if (!rest.isEmpty() && rest.charAt(0) >= '1' && rest.charAt(0) <= '9') {
                    line.continuation = true;
                    rest = rest.substring(1);
                }
                line.regular = true;
                line.splitCode(rest);
                return line;
            }
            String labelField = raw.substring(0, Math.min(LABEL_END, raw.length()));
            int bang = labelField.indexOf('!');
            if (bang >= 0) {
                line.verbatim = raw.substring(bang);
                return line;
            }
            line.regular = true;
            line.label = labelField.trim();
            if (raw.length() > LABEL_END) {
                char marker = raw.charAt(LABEL_END);
                line.continuation = marker != ' ' && marker != '0';
            }
            String body = raw.length() > CODE_START ? raw.substring(CODE_START) : "";
            if (lengthLimit && raw.length() > LINE_LIMIT) {
                body = raw.substring(CODE_START, LINE_LIMIT);
                line.comment = "!" + raw.substring(LINE_LIMIT);
            }
            line.splitCode(body);
            return line;
        }

        private void splitCode(String body) {
            int bang = SourceText.commentStart(body, (char) 0);
            if (bang >= 0) {
                String inline = body.substring(bang);
                comment = comment.isEmpty() ? inline : inline + " " + comment.substring(1);
                body = body.substring(0, bang);
            }
            code = body.stripTrailing();
            if (code.isBlank() && label.isEmpty() && !continuation) {
                regular = false;
            }
        }

        String render() {
            if (verbatim != null) {
                return verbatim;
            }
            StringBuilder out = new StringBuilder();
            if (continuation) {
                out.append("     &");
            } else if (!label.isEmpty()) {
                out.append(label).append(' ');
            } else {
                out.append("      ");
            }
            out.append(code);
            if (continued) {
                out.append(SourceText.openQuote(code) != 0 ? "&" : " &");
            }
            if (!comment.isEmpty()) {
                out.append(' ').append(comment);
            }
            return out.toString();
        }
    }
}
