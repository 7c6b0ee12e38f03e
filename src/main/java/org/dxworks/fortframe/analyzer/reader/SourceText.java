package org.dxworks.fortframe.analyzer.reader;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote and bracket aware string helpers for Fortran statements.
 */
public final class SourceText {

    private SourceText() {
    }

    /**
     * Returns the index of the first {@code !} that is not inside a character literal, or -1.
     *
     * @param openQuote the quote still open from previous continued lines, or 0
     */
    public static int commentStart(String line, char openQuote) {
        char quote = openQuote;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == quote) {
                        i++;
                    } else {
                        quote = 0;
                    }
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '!') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Quote character left open at the end of {@code text}, or 0 when every literal is terminated.
     */
    public static char openQuote(String text) {
        return openQuote(text, (char) 0);
    }

    /**
     * Quote character left open at the end of {@code text} when it starts inside a literal opened by
     * {@code openQuote}.
     */
    public static char openQuote(String text, char openQuote) {
        char quote = openQuote;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            }
        }
        return quote;
    }

    /**
     * Splits on {@code separator} wherever it is outside a character literal. Empty pieces are kept.
     */
    public static List<String> quoteSplit(char separator, String text) {
        List<String> pieces = new ArrayList<>();
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == separator) {
                pieces.add(text.substring(start, i));
                start = i + 1;
            }
        }
        pieces.add(text.substring(start));
        return pieces;
    }

    /**
     * Splits on {@code separator} wherever it is outside parentheses, brackets and character literals.
     */
    public static List<String> parenSplit(char separator, String text) {
        List<String> pieces = new ArrayList<>();
        int parens = 0;
        int brackets = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            switch (c) {
                case '\'', '"' -> quote = c;
                case '(' -> parens++;
                case ')' -> parens--;
                case '[' -> brackets++;
                case ']' -> brackets--;
                default -> {
                    if (c == separator && parens == 0 && brackets == 0) {
                        pieces.add(text.substring(start, i));
                        start = i + 1;
                    }
                }
            }
        }
        pieces.add(text.substring(start));
        return pieces;
    }

    /**
     * Returns the prefix of {@code text} up to and including the bracket that closes the group it starts with.
     */
    public static String balancedPrefix(String text) {
        if (text.isEmpty()) {
            return text;
        }
        int parens = 0;
        int brackets = 0;
        for (int i = 0; i < text.length(); i++) {
            switch (text.charAt(i)) {
                case '(' -> parens++;
                case ')' -> parens--;
                case '[' -> brackets++;
                case ']' -> brackets--;
                default -> {
                }
            }
            if (parens == 0 && brackets == 0) {
                return text.substring(0, i + 1);
            }
        }
        throw new IllegalArgumentException("Unbalanced parentheses: " + text);
    }

    /**
     * Strips one enclosing pair of parentheses, if present.
     */
    public static String stripParens(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
