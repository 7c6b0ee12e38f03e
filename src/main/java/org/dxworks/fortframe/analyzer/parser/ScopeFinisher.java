package org.dxworks.fortframe.analyzer.parser;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.model.CodeUnit;
import org.dxworks.fortframe.model.CommonBlock;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.Enumeration;
import org.dxworks.fortframe.model.Function;
import org.dxworks.fortframe.model.Interface;
import org.dxworks.fortframe.model.Permission;
import org.dxworks.fortframe.model.Procedure;
import org.dxworks.fortframe.model.ScopeTables;
import org.dxworks.fortframe.model.Variable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Local clean-up run when a scope's {@code end} statement is read. Nothing here looks outside the scope.
 */
final class ScopeFinisher {

    private final Diagnostics diagnostics;

    ScopeFinisher(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    void finish(ScopeState state) {
        Entity scope = state.scope;
        if (scope instanceof CodeUnit unit) {
            applyAttributes(unit, state.attributes);
            if (unit instanceof Procedure procedure) {
                resolveArguments(procedure);
            }
            if (unit instanceof Function function) {
                resolveResult(function);
            }
            resolveCommonBlocks(unit);
        } else if (scope instanceof DerivedType type) {
            matchTypeParameters(type);
        } else if (scope instanceof Enumeration enumeration) {
            numberEnumerators(enumeration);
        }
    }

    /**
     * Splits an abstract or anonymous interface block into one interface per procedure, in declaration order.
     * A generic block is returned as it is.
     */
    List<Interface> unwrap(Interface block) {
        if (block.generic) {
            return List.of(block);
        }
        if (!block.moduleProcedures.isEmpty()) {
            diagnostics.warn("Ignoring MODULE PROCEDURE statements in non-generic interface block at line "
                    + block.lineNumber + " of " + block.getSourceFile().getName());
        }
        List<Procedure> procedures = block.memberProcedures();
        procedures.sort(Comparator.comparingInt(procedure -> procedure.lineNumber));
        List<Interface> contents = new ArrayList<>();
        for (Procedure procedure : procedures) {
            contents.add(Interface.wrapping(procedure, block));
        }
        return contents;
    }

    private void applyAttributes(CodeUnit unit, AttributeTable table) {
        for (Map.Entry<String, List<String>> entry : table.attributes.entrySet()) {
            if (entry.getValue().contains("public")) {
                unit.publicNames.add(entry.getKey());
            }
            if (entry.getValue().contains("private")) {
                unit.privateNames.add(entry.getKey());
            }
        }

        List<Entity> items = new ArrayList<>();
        items.addAll(unit.functions);
        items.addAll(unit.subroutines);
        items.addAll(unit.types);
        items.addAll(unit.interfaces);
        items.addAll(unit.absInterfaces);
        for (Entity item : items) {
            for (String attribute : table.take(item.getName())) {
                if (Permission.isPermission(attribute)) {
                    item.permission = Permission.parse(attribute);
                } else if (attribute.startsWith("bind") && item instanceof Procedure procedure) {
                    procedure.bindC = attribute.substring(attribute.indexOf('(') + 1, attribute.length() - 1);
                }
            }
        }

        List<Variable> variables = new ArrayList<>(unit.variables);
        for (Enumeration enumeration : unit.enums) {
            variables.addAll(enumeration.variables);
        }
        for (Variable variable : variables) {
            for (String attribute : table.take(variable.getName())) {
                applyVariableAttribute(variable, attribute, table);
            }
        }

        for (Entity item : items) {
            if (item.permission == Permission.PUBLIC) {
                unit.publicNames.add(ScopeTables.key(item.getName()));
            }
        }
        for (Variable variable : variables) {
            if (variable.permission == Permission.PUBLIC) {
                unit.publicNames.add(ScopeTables.key(variable.getName()));
            }
        }

        for (Map.Entry<String, List<String>> entry : table.attributes.entrySet()) {
            for (String attribute : entry.getValue()) {
                if (!Permission.isPermission(attribute) && !attribute.equals("save")) {
                    diagnostics.warn("Attribute '" + attribute + "' given to unknown entity '" + entry.getKey()
                            + "' in " + unit.getKind().getName() + " '" + unit.getName() + "'");
                }
            }
        }
    }

    private static void applyVariableAttribute(Variable variable, String attribute, AttributeTable table) {
        if (Permission.isPermission(attribute)) {
            variable.permission = Permission.parse(attribute);
        } else if (attribute.equals("optional")) {
            variable.optional = true;
        } else if (attribute.equals("parameter")) {
            variable.parameter = true;
            if (!variable.attributes.contains("parameter")) {
                variable.attributes.add("parameter");
            }
            String value = table.parameterValues.get(variable.getLowerName());
            if (value != null) {
                variable.initial = value;
            }
        } else if (attribute.startsWith("intent(")) {
            variable.intent = attribute.substring("intent(".length(), attribute.length() - 1);
        } else if (attribute.startsWith("dimension")) {
            variable.dimension = attribute.substring("dimension".length());
        } else if (attribute.startsWith("allocatable") || attribute.startsWith("pointer")
                || attribute.startsWith("target") || attribute.startsWith("codimension")) {
            int shape = Math.max(attribute.indexOf('('), attribute.indexOf('['));
            if (shape > 0) {
                variable.dimension = attribute.substring(shape);
                attribute = attribute.substring(0, shape);
            }
            if (!variable.attributes.contains(attribute)) {
                variable.attributes.add(attribute);
            }
        } else if (!variable.attributes.contains(attribute)) {
            variable.attributes.add(attribute);
        }
    }

    private void resolveArguments(Procedure procedure) {
        for (String argName : procedure.argNames) {
            if (argName.equals("*")) {
                Variable alternateReturn = new Variable("*", procedure, procedure.permission, "alternate return");
                alternateReturn.lineNumber = procedure.lineNumber;
                procedure.args.add(alternateReturn);
                continue;
            }
            Variable variable = removeVariable(procedure.variables, argName);
            if (variable != null) {
                procedure.args.add(variable);
                continue;
            }
            Interface procedureArgument = removeProcedureInterface(procedure.interfaces, argName);
            if (procedureArgument != null) {
                procedure.args.add(procedureArgument.unwrap(procedure));
                continue;
            }
            procedure.args.add(ImplicitTyping.legacyImplicitVariable(argName, procedure));
        }
    }

    private static void resolveResult(Function function) {
        if (function.result != null) {
            return;
        }
        Variable declared = removeVariable(function.variables, function.resultName);
        function.result = declared != null
                ? declared
                : ImplicitTyping.legacyImplicitVariable(function.resultName, function);
    }

    /**
     * Moves each common block member out of the unit's variables and into its block. A member with no declaration
     * gets the legacy implicit type; a shape written in the common statement is kept when the declaration has none.
     */
    private static void resolveCommonBlocks(CodeUnit unit) {
        for (CommonBlock block : unit.commonBlocks) {
            for (String member : block.memberNames) {
                int paren = member.indexOf('(');
                String name = (paren >= 0 ? member.substring(0, paren) : member).strip();
                Variable variable = removeVariable(unit.variables, name);
                if (variable == null) {
                    variable = ImplicitTyping.legacyImplicitVariable(name, block);
                } else {
                    variable.parent = block;
                }
                if (paren >= 0 && variable.dimension == null) {
                    variable.dimension = member.substring(paren).replace(" ", "");
                }
                block.variables.add(variable);
            }
        }
    }

    private void matchTypeParameters(DerivedType type) {
        for (String parameterName : type.parameterNames) {
            Variable parameter = removeVariable(type.variables, parameterName);
            if (parameter != null) {
                type.parameters.add(parameter);
            } else {
                diagnostics.warn("Type parameter '" + parameterName + "' of type '" + type.getName()
                        + "' has no kind or len declaration");
            }
        }
    }

    private static void numberEnumerators(Enumeration enumeration) {
        long next = 0;
        boolean known = true;
        for (Variable enumerator : enumeration.variables) {
            if (enumerator.initial != null) {
                try {
                    next = Long.parseLong(enumerator.initial.strip()) + 1;
                    known = true;
                } catch (NumberFormatException e) {
                    known = false;
                }
            } else if (known) {
                enumerator.initial = Long.toString(next);
                next++;
            }
            enumerator.parameter = true;
        }
    }

    private static Variable removeVariable(List<Variable> variables, String name) {
        Iterator<Variable> iterator = variables.iterator();
        while (iterator.hasNext()) {
            Variable variable = iterator.next();
            if (variable.getName().equalsIgnoreCase(name)) {
                iterator.remove();
                return variable;
            }
        }
        return null;
    }

    private static Interface removeProcedureInterface(List<Interface> interfaces, String name) {
        Iterator<Interface> iterator = interfaces.iterator();
        while (iterator.hasNext()) {
            Interface candidate = iterator.next();
            if (!candidate.generic && candidate.getProcedure() != null && candidate.getName().equalsIgnoreCase(name)) {
                iterator.remove();
                return candidate;
            }
        }
        return null;
    }
}
