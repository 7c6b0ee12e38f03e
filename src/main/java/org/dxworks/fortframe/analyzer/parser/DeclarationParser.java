package org.dxworks.fortframe.analyzer.parser;

import org.dxworks.fortframe.analyzer.reader.SourceText;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.Permission;
import org.dxworks.fortframe.model.Ref;
import org.dxworks.fortframe.model.Variable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits type declaration statements into their type, shared attributes and per-name parts.
 */
final class DeclarationParser {

    private static final Pattern TYPE_KEYWORD = Pattern.compile(
            "^(integer|real|double\\s*precision|character|complex|double\\s*complex|logical|type|class|procedure|enumerator)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PROTOTYPE = Pattern.compile("^(\\*|\\w+)\\s*(?:\\((.*)\\))?$");
    private static final Pattern LEADING_DIGITS = Pattern.compile("^\\d+");

    private DeclarationParser() {
    }

    static TypeSpec parseType(String text) {
        Matcher keyword = TYPE_KEYWORD.matcher(text);
        if (!keyword.lookingAt()) {
            throw new IllegalArgumentException("Not a type declaration: " + text);
        }
        TypeSpec spec = new TypeSpec();
        spec.vartype = keyword.group(1).toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (spec.vartype.startsWith("double") && !spec.vartype.contains(" ")) {
            spec.vartype = spec.vartype.replace("double", "double ");
        }
        String rest = text.substring(keyword.end()).strip();
        spec.rest = rest;
        if (rest.isEmpty()) {
            return spec;
        }

        if (rest.startsWith("*")) {
            rest = rest.substring(1).strip();
            String args;
            if (rest.startsWith("(")) {
                args = SourceText.balancedPrefix(rest);
                rest = rest.substring(args.length()).strip();
                args = SourceText.stripParens(args);
            } else {
                Matcher digits = LEADING_DIGITS.matcher(rest);
                args = digits.lookingAt() ? digits.group() : "";
                rest = rest.substring(args.length()).strip();
            }
            if (spec.vartype.equals("character")) {
                spec.strlen = args;
            } else {
                spec.kind = args;
            }
            spec.rest = rest;
            return spec;
        }

        if (!rest.startsWith("(")) {
            return spec;
        }
        String args = SourceText.balancedPrefix(rest);
        spec.rest = rest.substring(args.length()).strip();
        args = SourceText.stripParens(args);

        switch (spec.vartype) {
            case "type", "class", "procedure" -> {
                Matcher prototype = PROTOTYPE.matcher(args);
                if (prototype.matches()) {
                    spec.prototypeName = prototype.group(1);
                    spec.prototypeArgs = prototype.group(2) == null ? "" : prototype.group(2).strip();
                }
            }
            case "character" -> {
                List<String> parts = SourceText.parenSplit(',', args);
                for (int i = 0; i < parts.size(); i++) {
                    String part = parts.get(i).strip();
                    String compact = part.toLowerCase(Locale.ROOT).replace(" ", "");
                    if (compact.startsWith("len=")) {
                        spec.strlen = part.substring(part.indexOf('=') + 1).strip();
                    } else if (compact.startsWith("kind=")) {
                        spec.kind = part.substring(part.indexOf('=') + 1).strip();
                    } else if (i == 0) {
                        spec.strlen = part;
                    } else if (i == 1) {
                        spec.kind = part;
                    }
                }
            }
            default -> {
                String compact = args.toLowerCase(Locale.ROOT).replace(" ", "");
                spec.kind = compact.startsWith("kind=") ? args.substring(args.indexOf('=') + 1).strip() : args;
            }
        }
        return spec;
    }

    /**
     * One variable per declared name. Attributes before {@code ::} are shared; shape, initializer and
     * pointer association are kept per name.
     */
    static List<Variable> toVariables(TypeSpec spec, MaskedLine masked, Entity parent, Permission ambient) {
        Permission permission = ambient;
        List<String> attributes = new ArrayList<>();
        String intent = null;
        boolean optional = false;
        boolean parameter = false;
        String sharedDimension = null;

        String rest = spec.rest;
        String declarations;
        if (rest.startsWith(",")) {
            int separator = rest.indexOf("::");
            String attributeText = separator < 0 ? rest.substring(1) : rest.substring(1, separator);
            declarations = separator < 0 ? "" : rest.substring(separator + 2);
            for (String piece : SourceText.parenSplit(',', attributeText)) {
                String attribute = piece.strip();
                String compact = attribute.toLowerCase(Locale.ROOT).replace(" ", "");
                if (compact.isEmpty()) {
                    continue;
                }
                if (Permission.isPermission(compact)) {
                    permission = Permission.parse(compact);
                } else if (compact.equals("optional")) {
                    optional = true;
                } else if (compact.equals("parameter")) {
                    parameter = true;
                    attributes.add("parameter");
                } else if (compact.startsWith("intent(")) {
                    intent = compact.substring("intent(".length(), compact.length() - 1);
                } else if (compact.startsWith("dimension(") || compact.startsWith("dimension[")) {
                    sharedDimension = compact.substring("dimension".length());
                } else {
                    attributes.add(attribute);
                }
            }
        } else {
            declarations = rest.startsWith("::") ? rest.substring(2) : rest;
        }

        List<Variable> variables = new ArrayList<>();
        for (String piece : SourceText.parenSplit(',', declarations)) {
            String declaration = piece.strip();
            if (declaration.isEmpty()) {
                continue;
            }
            String initial = null;
            boolean points = false;
            int eq = topLevelEquals(declaration);
            String declared = declaration;
            if (eq >= 0) {
                declared = declaration.substring(0, eq).strip();
                initial = declaration.substring(eq + 1).strip();
                if (initial.startsWith(">")) {
                    points = true;
                    initial = initial.substring(1).strip();
                }
                initial = masked.restore(initial);
            }

            String name = declared;
            String dimension = sharedDimension;
            String strlen = spec.strlen;
            int star = declared.indexOf('*');
            int shape = firstShapeIndex(declared);
            if (shape >= 0 && (star < 0 || shape < star)) {
                name = declared.substring(0, shape).strip();
                String shapeText = declared.substring(shape);
                int lengthStar = shapeText.lastIndexOf('*');
                String balanced = SourceText.balancedPrefix(shapeText);
                dimension = balanced.replace(" ", "");
                if (lengthStar > balanced.length() - 1) {
                    strlen = SourceText.stripParens(shapeText.substring(lengthStar + 1));
                }
            } else if (star >= 0) {
                name = declared.substring(0, star).strip();
                strlen = SourceText.stripParens(declared.substring(star + 1));
            }

            Variable variable = new Variable(name, parent, permission, spec.vartype);
            variable.kind = spec.kind;
            variable.strlen = strlen;
            if (spec.prototypeName != null) {
                variable.prototype = Ref.unresolved(spec.prototypeName);
            }
            variable.attributes.addAll(attributes);
            variable.intent = intent;
            variable.optional = optional;
            variable.parameter = parameter;
            variable.initial = initial;
            variable.points = points;
            variable.dimension = dimension;
            variables.add(variable);
        }
        return variables;
    }

    /**
     * Splits the body of a {@code common} or {@code namelist} statement into its {@code /name/ list} groups. Members
     * listed before any name, or after {@code //}, belong to the blank group {@code ""}; repeated names are merged.
     */
    static Map<String, List<String>> slashGroups(String body) {
        Map<String, List<String>> groups = new LinkedHashMap<>();
        String text = body.strip();
        String name = "";
        int start = 0;
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == '/' && depth == 0) {
                addMembers(groups, name, text.substring(start, i));
                int close = text.indexOf('/', i + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated group name in '" + body + "'");
                }
                name = text.substring(i + 1, close).strip();
                i = close;
                start = close + 1;
            }
        }
        addMembers(groups, name, text.substring(start));
        return groups;
    }

    private static void addMembers(Map<String, List<String>> groups, String name, String list) {
        for (String member : SourceText.parenSplit(',', list)) {
            String stripped = member.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            String key = groups.keySet().stream().filter(name::equalsIgnoreCase).findFirst().orElse(name);
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(stripped);
        }
    }

    private static int topLevelEquals(String declaration) {
        int depth = 0;
        for (int i = 0; i < declaration.length(); i++) {
            char c = declaration.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == '=' && depth == 0) {
                return i;
            }
        }
        return -1;
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
