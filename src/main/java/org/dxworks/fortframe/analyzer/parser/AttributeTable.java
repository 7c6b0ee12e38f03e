package org.dxworks.fortframe.analyzer.parser;

import org.dxworks.fortframe.analyzer.reader.SourceText;
import org.dxworks.fortframe.model.ScopeTables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Attributes given by standalone statements such as {@code public :: a, b} or {@code dimension x(3)}. They are
 * applied to the named entities when the scope closes.
 */
final class AttributeTable {

    /** Lower-cased entity name to attributes, e.g. {@code "intent(in)"} or {@code "dimension(3)"}. */
    final Map<String, List<String>> attributes = new LinkedHashMap<>();
    /** Lower-cased parameter name to its value. */
    final Map<String, String> parameterValues = new LinkedHashMap<>();

    void record(String attribute, String names, MaskedLine masked) {
        String attr = attribute.toLowerCase(Locale.ROOT).replace(" ", "");
        switch (attr) {
            case "data" -> {
            }
            case "dimension", "allocatable", "pointer", "target", "codimension" -> {
                for (String piece : SourceText.parenSplit(',', names)) {
                    String declared = piece.strip().toLowerCase(Locale.ROOT);
                    int shape = firstShapeIndex(declared);
                    if (shape >= 0) {
                        add(declared.substring(0, shape), attr + declared.substring(shape).replace(" ", ""));
                    } else if (!declared.isEmpty()) {
                        add(declared, attr);
                    }
                }
            }
            case "parameter" -> {
                for (String piece : SourceText.parenSplit(',', SourceText.stripParens(names))) {
                    int eq = piece.indexOf('=');
                    if (eq < 0) {
                        continue;
                    }
                    String name = piece.substring(0, eq).strip().toLowerCase(Locale.ROOT);
                    parameterValues.put(name, masked.restore(piece.substring(eq + 1).strip()));
                    add(name, attr);
                }
            }
            default -> {
                for (String piece : SourceText.parenSplit(',', names)) {
                    String name = piece.strip();
                    if (!name.isEmpty()) {
                        add(name, attr);
                    }
                }
            }
        }
    }

    List<String> take(String name) {
        List<String> found = attributes.remove(ScopeTables.key(name));
        return found == null ? List.of() : found;
    }

    private void add(String name, String attr) {
        attributes.computeIfAbsent(ScopeTables.key(name), key -> new ArrayList<>()).add(attr);
    }

    private static int firstShapeIndex(String declared) {
        int paren = declared.indexOf('(');
        int bracket = declared.indexOf('[');
        if (paren < 0) {
            return bracket;
        }
        return bracket < 0 ? paren : Math.min(paren, bracket);
    }
}
