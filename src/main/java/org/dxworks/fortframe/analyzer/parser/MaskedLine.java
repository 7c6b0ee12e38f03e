package org.dxworks.fortframe.analyzer.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A statement whose character literals are replaced by numbered placeholders, so that classifiers never see
 * keywords or separators inside strings.
 */
final class MaskedLine {

    private static final Pattern PLACEHOLDER = Pattern.compile("\"(\\d+)\"");

    private final String text;
    private final List<String> literals;

    private MaskedLine(String text, List<String> literals) {
        this.text = text;
        this.literals = literals;
    }

    static MaskedLine mask(String statement) {
        List<String> literals = new ArrayList<>();
        StringBuilder masked = new StringBuilder();
        int i = 0;
        while (i < statement.length()) {
            char c = statement.charAt(i);
            if (c != '\'' && c != '"') {
                masked.append(c);
                i++;
                continue;
            }
            int end = i + 1;
            while (end < statement.length()) {
                if (statement.charAt(end) == c) {
                    if (end + 1 < statement.length() && statement.charAt(end + 1) == c) {
                        end += 2;
                        continue;
                    }
                    break;
                }
                end++;
            }
            end = Math.min(end, statement.length() - 1);
            masked.append('"').append(literals.size()).append('"');
            literals.add(statement.substring(i, end + 1));
            i = end + 1;
        }
        return new MaskedLine(masked.toString(), literals);
    }

    String text() {
        return text;
    }

    /**
     * Puts the original literals back into a fragment of the masked text.
     */
    String restore(String fragment) {
        if (fragment == null || literals.isEmpty()) {
            return fragment;
        }
        Matcher matcher = PLACEHOLDER.matcher(fragment);
        StringBuilder restored = new StringBuilder();
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            String literal = index < literals.size() ? literals.get(index) : matcher.group();
            matcher.appendReplacement(restored, Matcher.quoteReplacement(literal));
        }
        matcher.appendTail(restored);
        return restored.toString();
    }
}
