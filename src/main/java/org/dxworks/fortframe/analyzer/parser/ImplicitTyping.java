package org.dxworks.fortframe.analyzer.parser;

import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.Variable;

import java.util.Locale;

/**
 * Legacy first-letter typing for dummy arguments and function results that have no declaration: names starting
 * with {@code i} to {@code n} are integers, everything else is real. This ignores {@code implicit} statements and
 * is only an approximation of the language rule.
 */
public final class ImplicitTyping {

    private ImplicitTyping() {
    }

    public static String legacyImplicitType(String name) {
        if (name.isEmpty()) {
            return "real";
        }
        char first = name.toLowerCase(Locale.ROOT).charAt(0);
        return first >= 'i' && first <= 'n' ? "integer" : "real";
    }

    public static Variable legacyImplicitVariable(String name, Entity parent) {
        Variable variable = new Variable(name, parent, parent.permission, legacyImplicitType(name));
        variable.implicitlyTyped = true;
        variable.lineNumber = parent.lineNumber;
        return variable;
    }
}
