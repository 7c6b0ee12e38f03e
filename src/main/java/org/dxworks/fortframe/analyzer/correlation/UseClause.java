package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.analyzer.reader.SourceText;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.ScopeTables;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The {@code only:} and rename part of a {@code use} statement, applied to the export tables of the used module.
 */
final class UseClause {

    private static final Pattern ONLY = Pattern.compile("^\\s*,\\s*only\\s*:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern RENAME = Pattern.compile("^\\s*(\\w+)\\s*=>\\s*(\\w+)\\s*$");

    private final boolean only;
    /**
     * Remote name to the local names it is visible under. For an only-list every listed name appears, renamed or
     * not, and one remote entity may be listed under several local names.
     */
    private final Map<String, List<String>> names = new LinkedHashMap<>();

    private UseClause(boolean only) {
        this.only = only;
    }

    static UseClause parse(String clause) {
        Matcher onlyMatcher = ONLY.matcher(clause);
        boolean only = onlyMatcher.lookingAt();
        UseClause useClause = new UseClause(only);
        String list = only ? clause.substring(onlyMatcher.end()) : clause.replaceFirst("^\\s*,", "");
        for (String item : SourceText.parenSplit(',', list)) {
            if (item.isBlank()) {
                continue;
            }
            Matcher rename = RENAME.matcher(item);
            if (rename.matches()) {
                useClause.addName(ScopeTables.key(rename.group(2)), ScopeTables.key(rename.group(1)));
            } else if (only) {
                String name = ScopeTables.key(item);
                useClause.addName(name, name);
            }
        }
        return useClause;
    }

    private void addName(String remote, String local) {
        List<String> locals = names.computeIfAbsent(remote, key -> new ArrayList<>());
        if (!locals.contains(local)) {
            locals.add(local);
        }
    }

    /**
     * The part of {@code exports} this clause brings into scope, under local names.
     */
    ScopeTables apply(ScopeTables exports) {
        ScopeTables visible = new ScopeTables();
        filter(exports.procedures, visible.procedures);
        filter(exports.types, visible.types);
        filter(exports.absInterfaces, visible.absInterfaces);
        filter(exports.variables, visible.variables);
        return visible;
    }

    private <T extends Entity> void filter(Map<String, T> from, Map<String, T> into) {
        if (only) {
            names.forEach((remote, locals) -> {
                T entity = from.get(remote);
                if (entity != null) {
                    locals.forEach(local -> into.putIfAbsent(local, entity));
                }
            });
            return;
        }
        from.forEach((remote, entity) -> {
            for (String local : names.getOrDefault(remote, List.of(remote))) {
                into.putIfAbsent(local, entity);
            }
        });
    }
}
