package org.dxworks.fortframe.model;

import java.util.EnumSet;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Leading {@code key: value} documentation lines, such as {@code !! display: public private}.
 * They are moved out of the documentation text into {@link Entity#metadata}.
 */
public final class DocMetadata {

    private static final Pattern META_LINE = Pattern.compile("^\\s*(\\w+)\\s*:\\s*(.*?)\\s*$");
    private static final Set<String> KEYS = Set.of(
            "display", "proc_internals", "author", "date", "version", "license", "deprecated", "summary");

    private DocMetadata() {
    }

    public static void extract(Entity entity) {
        Iterator<String> lines = entity.docLines.iterator();
        boolean found = false;
        while (lines.hasNext()) {
            String line = lines.next();
            Matcher matcher = META_LINE.matcher(line);
            if (!matcher.matches() || !KEYS.contains(matcher.group(1).toLowerCase(Locale.ROOT))) {
                if (found && line.isBlank()) {
                    lines.remove();
                }
                break;
            }
            entity.metadata.put(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
            lines.remove();
            found = true;
        }
    }

    /**
     * The display set named by the entity's metadata, or empty when it names none.
     */
    public static Optional<Set<Permission>> display(Entity entity) {
        String value = entity.metadata.get("display");
        if (value == null) {
            return Optional.empty();
        }
        Set<Permission> display = EnumSet.noneOf(Permission.class);
        for (String word : value.toLowerCase(Locale.ROOT).split("[\\s,]+")) {
            if (word.equals("none")) {
                return Optional.of(EnumSet.noneOf(Permission.class));
            }
            if (Permission.isPermission(word)) {
                display.add(Permission.parse(word));
            }
        }
        return display.isEmpty() ? Optional.empty() : Optional.of(display);
    }

    public static Optional<Boolean> procInternals(Entity entity) {
        String value = entity.metadata.get("proc_internals");
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(value.trim().equalsIgnoreCase("true"));
    }
}
