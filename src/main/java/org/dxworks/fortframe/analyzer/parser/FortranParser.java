package org.dxworks.fortframe.analyzer.parser;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.analyzer.reader.DocMarks;
import org.dxworks.fortframe.analyzer.reader.FortranReader;
import org.dxworks.fortframe.analyzer.reader.SourceText;
import org.dxworks.fortframe.model.BlockData;
import org.dxworks.fortframe.model.BoundProcedure;
import org.dxworks.fortframe.model.CallSite;
import org.dxworks.fortframe.model.CodeUnit;
import org.dxworks.fortframe.model.CommonBlock;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.Enumeration;
import org.dxworks.fortframe.model.FinalProcedure;
import org.dxworks.fortframe.model.Function;
import org.dxworks.fortframe.model.Interface;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.ModuleProcedureImplementation;
import org.dxworks.fortframe.model.ModuleProcedureReference;
import org.dxworks.fortframe.model.Namelist;
import org.dxworks.fortframe.model.Permission;
import org.dxworks.fortframe.model.Procedure;
import org.dxworks.fortframe.model.Program;
import org.dxworks.fortframe.model.Ref;
import org.dxworks.fortframe.model.SourceFile;
import org.dxworks.fortframe.model.Subroutine;
import org.dxworks.fortframe.model.Submodule;
import org.dxworks.fortframe.model.UseStatement;
import org.dxworks.fortframe.model.Variable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

import static org.dxworks.fortframe.analyzer.parser.FortranPatterns.*;

/**
 * Builds the entity tree of one source file from the statements of a {@link FortranReader}. Each container is
 * parsed by a recursive call that returns when its {@code end} statement is read.
 */
public class FortranParser {

    private final Diagnostics diagnostics;
    private final ScopeFinisher finisher;

    public FortranParser(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.finisher = new ScopeFinisher(diagnostics);
    }

    public SourceFile parse(FortranReader reader) {
        SourceFile file = new SourceFile(reader.getFile(), reader.getRawText());
        new Session(reader, file).parseScope(new ScopeState(file, Permission.PUBLIC));
        return file;
    }

    private final class Session {
        private final FortranReader reader;
        private final DocMarks marks;
        private final SourceFile file;

        private Session(FortranReader reader, SourceFile file) {
            this.reader = reader;
            this.marks = reader.getDocMarks();
            this.file = file;
        }

        private void parseScope(ScopeState state) {
            while (reader.hasNext()) {
                String statement = reader.next();
                if (marks.isDocLine(statement)) {
                    state.scope.docLines.add(marks.docText(statement));
                    continue;
                }
                statement = LABEL.matcher(statement).replaceFirst("");
                MaskedLine masked = MaskedLine.mask(statement);
                try {
                    if (parseStatement(state, masked)) {
                        return;
                    }
                } catch (IllegalArgumentException e) {
                    throw error("Could not parse '" + statement + "': " + e.getMessage());
                }
            }
            if (!(state.scope instanceof SourceFile)) {
                throw error("File ended while still nested in " + state.scope.getKind().getName()
                        + " '" + state.scope.getName() + "'");
            }
        }

        /**
         * Handles one statement and returns true when it closes the current scope.
         */
        private boolean parseStatement(ScopeState state, MaskedLine masked) {
            String text = masked.text();
            Entity scope = state.scope;
            Matcher m;

            if ((m = END.matcher(text)).matches()) {
                return parseEnd(state, m);
            }
            if (CONTAINS.matcher(text).matches()) {
                if (!(scope instanceof CodeUnit) && !(scope instanceof DerivedType)) {
                    throw error("Unexpected CONTAINS statement in " + describe(scope));
                }
                if (state.inContains) {
                    throw error("Multiple CONTAINS statements present in " + describe(scope));
                }
                state.inContains = true;
                if (scope instanceof DerivedType) {
                    state.childPermission = Permission.PUBLIC;
                }
                return false;
            }
            if ((m = VISIBILITY.matcher(text)).matches()) {
                Permission permission = Permission.parse(m.group(1));
                if (scope instanceof Module module) {
                    module.defaultAccess = permission;
                    state.childPermission = permission;
                } else if (scope instanceof DerivedType) {
                    state.childPermission = permission;
                } else {
                    throw error("Visibility statement '" + text + "' outside a module or type in " + describe(scope));
                }
                return false;
            }
            if (SEQUENCE.matcher(text).matches()) {
                if (!(scope instanceof DerivedType type)) {
                    throw error("SEQUENCE statement outside a derived type");
                }
                type.sequence = true;
                return false;
            }
            if (FORMAT.matcher(text).matches() || ARITHMETIC_GOTO.matcher(text).matches()) {
                return false;
            }
            if (scope instanceof DerivedType type && state.inContains) {
                parseTypeBinding(state, type, masked);
                return false;
            }
            if ((m = ATTRIBUTE.matcher(text)).matches()) {
                if (scope instanceof CodeUnit && state.blockLevel == 0) {
                    state.attributes.record(masked.restore(m.group(1)), m.group(2), masked);
                }
                return false;
            }
            if ((m = MODULE_PROCEDURE.matcher(text)).matches() && parseModuleProcedure(state, m)) {
                return false;
            }
            if ((m = BLOCK_DATA.matcher(text)).matches()) {
                parseBlockData(state, m);
                return false;
            }
            if (BLOCK.matcher(text).matches()) {
                state.blockLevel++;
                return false;
            }
            if ((m = ASSOCIATE.matcher(text)).matches()) {
                state.associations.push(parseAssociations(m.group("associations")));
                return false;
            }
            if ((m = MODULE.matcher(text)).matches()) {
                parseModule(state, m);
                return false;
            }
            if ((m = SUBMODULE.matcher(text)).matches()) {
                parseSubmodule(state, m);
                return false;
            }
            if ((m = PROGRAM.matcher(text)).matches()) {
                parseProgram(state, m);
                return false;
            }
            if ((m = SUBROUTINE.matcher(text)).matches()) {
                parseProcedure(state, m, false, masked);
                return false;
            }
            if ((m = FUNCTION.matcher(text)).matches()) {
                parseProcedure(state, m, true, masked);
                return false;
            }
            if ((m = TYPE.matcher(text)).matches()) {
                parseDerivedType(state, m);
                return false;
            }
            if ((m = INTERFACE.matcher(text)).matches()) {
                parseInterface(state, m);
                return false;
            }
            if ((m = ENUM.matcher(text)).matches()) {
                parseEnum(state, m);
                return false;
            }
            if ((m = COMMON.matcher(text)).matches()) {
                parseCommon(state, m);
                return false;
            }
            if ((m = NAMELIST.matcher(text)).matches()) {
                parseNamelist(state, m);
                return false;
            }
            if (VARIABLE.matcher(text).matches()) {
                parseVariables(state, masked);
                return false;
            }
            if ((m = USE.matcher(text)).matches()) {
                if (!(scope instanceof CodeUnit unit)) {
                    throw error("USE statement in " + describe(scope));
                }
                boolean intrinsic = "intrinsic".equalsIgnoreCase(m.group("nature"));
                unit.uses.add(new UseStatement(m.group("name"), masked.restore(m.group("clause")), intrinsic));
                return false;
            }
            if ((m = CALL.matcher(text)).matches()) {
                parseCall(state, m);
            }
            return false;
        }

        private boolean parseEnd(ScopeState state, Matcher m) {
            String kind = m.group("kind") == null ? null : m.group("kind").toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
            boolean closesBlockData = "blockdata".equals(kind) && state.scope instanceof BlockData
                    && state.blockLevel == 0;
            if ("block".equals(kind) || ("blockdata".equals(kind) && !closesBlockData)) {
                if (state.blockLevel > 0) {
                    state.blockLevel--;
                }
                return false;
            }
            if ("associate".equals(kind)) {
                if (!state.associations.isEmpty()) {
                    state.associations.pop();
                }
                return false;
            }
            if (kind == null && state.blockLevel > 0) {
                state.blockLevel--;
                return false;
            }

            Entity scope = state.scope;
            String expected = endKeyword(scope);
            if (expected == null) {
                throw error("END statement '" + m.group() + "' outside of any nesting");
            }
            if (kind != null && !kind.equals(expected)) {
                throw error("END statement does not match " + describe(scope) + ": " + m.group());
            }
            String name = m.group("name");
            if (name != null && !namesMatch(scope, name)) {
                throw error("END statement name '" + name.strip() + "' does not match " + describe(scope));
            }
            finisher.finish(state);
            if (!(scope instanceof Interface block) || block.generic) {
                if (!scope.hasDocumentation()) {
                    diagnostics.warn("Undocumented " + describe(scope) + " in " + file.getName());
                }
            }
            return true;
        }

        private void parseModule(ScopeState state, Matcher m) {
            requireFileScope(state, "MODULE");
            if (m.group("name") == null) {
                throw error("MODULE statement without a name");
            }
            Module module = new Module(m.group("name"), file);
            module.lineNumber = reader.getLineNumber();
            parseScope(new ScopeState(module, module.defaultAccess));
            file.modules.add(module);
        }

        private void parseSubmodule(ScopeState state, Matcher m) {
            requireFileScope(state, "SUBMODULE");
            Submodule submodule = new Submodule(m.group("name"), file, m.group("ancestor"), m.group("parent"));
            submodule.lineNumber = reader.getLineNumber();
            parseScope(new ScopeState(submodule, submodule.defaultAccess));
            file.submodules.add(submodule);
        }

        private void parseProgram(ScopeState state, Matcher m) {
            requireFileScope(state, "PROGRAM");
            if (!file.programs.isEmpty()) {
                throw error("Multiple PROGRAM units in one file");
            }
            String name = m.group("name");
            if (name == null) {
                String fileName = file.getName();
                int dot = fileName.lastIndexOf('.');
                name = dot > 0 ? fileName.substring(0, dot) : fileName;
            }
            Program program = new Program(name, file);
            program.lineNumber = reader.getLineNumber();
            parseScope(new ScopeState(program, Permission.PUBLIC));
            file.programs.add(program);
        }

        private void parseBlockData(ScopeState state, Matcher m) {
            requireFileScope(state, "BLOCK DATA");
            BlockData blockData = new BlockData(m.group(1) == null ? "" : m.group(1), file);
            blockData.lineNumber = reader.getLineNumber();
            parseScope(new ScopeState(blockData, Permission.PUBLIC));
            file.blockData.add(blockData);
        }

        private void parseProcedure(ScopeState state, Matcher m, boolean isFunction, MaskedLine masked) {
            Entity scope = state.scope;
            boolean allowed = scope instanceof SourceFile || scope instanceof Interface
                    || (scope instanceof CodeUnit && state.inContains);
            if (!allowed) {
                throw error("Unexpected " + (isFunction ? "FUNCTION" : "SUBROUTINE") + " in " + describe(scope));
            }
            Permission permission = scope instanceof Interface block ? block.permission : state.childPermission;

            String name = m.group("name");
            Procedure procedure = isFunction
                    ? new Function(name, scope, permission, m.group("result"))
                    : new Subroutine(name, scope, permission);
            procedure.lineNumber = reader.getLineNumber();

            String remaining = "";
            if (m.group("attributes") != null) {
                Matcher prefix = PROCEDURE_PREFIX.matcher(m.group("attributes"));
                StringBuilder leftover = new StringBuilder();
                while (prefix.find()) {
                    String attribute = prefix.group(1).toLowerCase(Locale.ROOT);
                    if (attribute.equals("module")) {
                        procedure.separateModuleProcedure = true;
                    } else {
                        procedure.attributes.add(attribute);
                    }
                    prefix.appendReplacement(leftover, "");
                }
                prefix.appendTail(leftover);
                remaining = leftover.toString().strip();
            }
            if (!remaining.isEmpty()) {
                if (procedure instanceof Function function) {
                    TypeSpec spec = DeclarationParser.parseType(remaining);
                    Variable result = new Variable(function.resultName, function, permission, spec.vartype);
                    result.kind = spec.kind;
                    result.strlen = spec.strlen;
                    if (spec.prototypeName != null) {
                        result.prototype = Ref.unresolved(spec.prototypeName);
                    }
                    result.lineNumber = function.lineNumber;
                    function.result = result;
                } else {
                    throw error("Unexpected prefix '" + remaining + "' on SUBROUTINE " + name);
                }
            }

            if (m.group("arguments") != null) {
                for (String argument : SourceText.parenSplit(',', SourceText.stripParens(m.group("arguments")))) {
                    if (!argument.isBlank()) {
                        procedure.argNames.add(argument.strip());
                    }
                }
            }
            String bindC = m.group("bindC");
            if (bindC != null) {
                int close = bindC.indexOf(')');
                procedure.bindC = masked.restore((close >= 0 ? bindC.substring(0, close) : bindC).strip());
            }

            parseScope(new ScopeState(procedure, Permission.PUBLIC));

            if (scope instanceof SourceFile source) {
                addProcedure(source.functions, source.subroutines, procedure);
            } else if (scope instanceof Interface block) {
                addProcedure(block.functions, block.subroutines, procedure);
            } else {
                CodeUnit unit = (CodeUnit) scope;
                addProcedure(unit.functions, unit.subroutines, procedure);
            }
        }

        private void addProcedure(List<Function> functions, List<Subroutine> subroutines, Procedure procedure) {
            if (procedure instanceof Function function) {
                functions.add(function);
            } else {
                subroutines.add((Subroutine) procedure);
            }
        }

        private boolean parseModuleProcedure(ScopeState state, Matcher m) {
            Entity scope = state.scope;
            boolean moduleKeyword = m.group("module") != null;
            if (scope instanceof Interface block) {
                for (String name : SourceText.parenSplit(',', m.group("names"))) {
                    if (name.isBlank()) {
                        continue;
                    }
                    ModuleProcedureReference reference = new ModuleProcedureReference(name.strip(), block, block.permission);
                    reference.lineNumber = reader.getLineNumber();
                    block.moduleProcedures.add(reference);
                }
                return true;
            }
            if (!moduleKeyword) {
                return false;
            }
            if (!(scope instanceof Module module) || !state.inContains) {
                throw error("MODULE PROCEDURE statement outside an interface or the CONTAINS part of a module");
            }
            String name = m.group("names").strip();
            ModuleProcedureImplementation implementation =
                    new ModuleProcedureImplementation(name, module, state.childPermission);
            implementation.lineNumber = reader.getLineNumber();
            parseScope(new ScopeState(implementation, Permission.PUBLIC));
            module.modProcedures.add(implementation);
            return true;
        }

        private void parseDerivedType(ScopeState state, Matcher m) {
            if (!(state.scope instanceof CodeUnit unit)) {
                throw error("Derived type definition in " + describe(state.scope));
            }
            Permission permission = state.childPermission;
            String extendsName = null;
            List<String> attributes = new ArrayList<>();
            if (m.group("attributes") != null) {
                for (String piece : SourceText.parenSplit(',', m.group("attributes").substring(1))) {
                    String attribute = piece.strip();
                    if (attribute.isEmpty()) {
                        continue;
                    }
                    Matcher extendsMatcher = EXTENDS.matcher(attribute);
                    if (Permission.isPermission(attribute)) {
                        permission = Permission.parse(attribute);
                    } else if (extendsMatcher.matches()) {
                        extendsName = extendsMatcher.group(1);
                    } else {
                        attributes.add(attribute.toLowerCase(Locale.ROOT).replace(" ", ""));
                    }
                }
            }
            DerivedType type = new DerivedType(m.group("name"), unit, permission, extendsName);
            type.attributes.addAll(attributes);
            type.lineNumber = reader.getLineNumber();
            if (m.group("parameters") != null) {
                for (String parameter : SourceText.parenSplit(',', SourceText.stripParens(m.group("parameters")))) {
                    if (!parameter.isBlank()) {
                        type.parameterNames.add(parameter.strip());
                    }
                }
            }
            parseScope(new ScopeState(type, Permission.PUBLIC));
            unit.types.add(type);
        }

        private void parseInterface(ScopeState state, Matcher m) {
            if (!(state.scope instanceof CodeUnit unit)) {
                throw error("Interface block in " + describe(state.scope));
            }
            boolean isAbstract = m.group("abstract") != null;
            String name = m.group("name") == null ? "" : m.group("name").replaceAll("\\s+", "");
            boolean generic = !isAbstract && !name.isEmpty();
            Interface block = new Interface(name, unit, state.childPermission, generic, isAbstract);
            block.lineNumber = reader.getLineNumber();
            parseScope(new ScopeState(block, state.childPermission));

            List<Interface> contents = finisher.unwrap(block);
            if (isAbstract) {
                unit.absInterfaces.addAll(contents);
            } else {
                unit.interfaces.addAll(contents);
            }
        }

        private void parseEnum(ScopeState state, Matcher m) {
            if (!(state.scope instanceof CodeUnit unit)) {
                throw error("Enumeration in " + describe(state.scope));
            }
            Enumeration enumeration = new Enumeration(unit, state.childPermission, m.group("bindC") != null);
            enumeration.lineNumber = reader.getLineNumber();
            parseScope(new ScopeState(enumeration, state.childPermission));
            unit.enums.add(enumeration);
        }

        private void parseVariables(ScopeState state, MaskedLine masked) {
            Entity scope = state.scope;
            if (scope instanceof CodeUnit && state.blockLevel > 0) {
                return;
            }
            if (scope instanceof SourceFile) {
                throw error("Declaration '" + masked.restore(masked.text()) + "' outside any program unit");
            }
            TypeSpec spec = DeclarationParser.parseType(masked.text());
            List<Variable> variables = DeclarationParser.toVariables(spec, masked, scope, state.childPermission);
            int line = reader.getLineNumber();
            variables.forEach(variable -> variable.lineNumber = line);

            if (scope instanceof CodeUnit unit) {
                unit.variables.addAll(variables);
            } else if (scope instanceof DerivedType type) {
                type.variables.addAll(variables);
            } else if (scope instanceof Interface block) {
                block.variables.addAll(variables);
            } else if (scope instanceof Enumeration enumeration) {
                enumeration.variables.addAll(variables);
            }
            readDocs(variables);
        }

        private void parseCommon(ScopeState state, Matcher m) {
            if (!(state.scope instanceof CodeUnit unit)) {
                throw error("COMMON statement in " + describe(state.scope));
            }
            if (state.blockLevel > 0) {
                return;
            }
            List<CommonBlock> declared = new ArrayList<>();
            for (Map.Entry<String, List<String>> group : DeclarationParser.slashGroups(m.group("body")).entrySet()) {
                CommonBlock block = findByName(unit.commonBlocks, group.getKey());
                if (block == null) {
                    block = new CommonBlock(group.getKey(), unit);
                    block.lineNumber = reader.getLineNumber();
                    unit.commonBlocks.add(block);
                }
                block.memberNames.addAll(group.getValue());
                declared.add(block);
            }
            readDocs(declared);
        }

        private void parseNamelist(ScopeState state, Matcher m) {
            if (!(state.scope instanceof CodeUnit unit)) {
                throw error("NAMELIST statement in " + describe(state.scope));
            }
            if (state.blockLevel > 0) {
                return;
            }
            List<Namelist> declared = new ArrayList<>();
            for (Map.Entry<String, List<String>> group : DeclarationParser.slashGroups(m.group("body")).entrySet()) {
                if (group.getKey().isEmpty()) {
                    throw error("NAMELIST group without a name: " + m.group());
                }
                Namelist namelist = findByName(unit.namelists, group.getKey());
                if (namelist == null) {
                    namelist = new Namelist(group.getKey(), unit, state.childPermission);
                    namelist.lineNumber = reader.getLineNumber();
                    unit.namelists.add(namelist);
                }
                for (String member : group.getValue()) {
                    namelist.variables.add(Ref.unresolved(member));
                }
                declared.add(namelist);
            }
            readDocs(declared);
        }

        private void parseTypeBinding(ScopeState state, DerivedType type, MaskedLine masked) {
            String text = masked.text();
            Matcher m = FINAL.matcher(text);
            if (m.matches()) {
                List<FinalProcedure> finals = new ArrayList<>();
                for (String name : SourceText.parenSplit(',', m.group("names"))) {
                    if (!name.isBlank()) {
                        FinalProcedure finalProcedure = new FinalProcedure(name.strip(), type, Permission.PUBLIC);
                        finalProcedure.lineNumber = reader.getLineNumber();
                        finals.add(finalProcedure);
                    }
                }
                type.finalProcedures.addAll(finals);
                readDocs(finals);
                return;
            }
            m = BOUND_PROCEDURE.matcher(text);
            if (!m.matches()) {
                throw error("Unexpected statement in the CONTAINS part of type '" + type.getName() + "': " + text);
            }
            boolean generic = m.group("generic").equalsIgnoreCase("generic");
            String prototype = m.group("prototype") == null ? null : SourceText.stripParens(m.group("prototype")).strip();
            Permission permission = state.childPermission;
            boolean deferred = false;
            List<String> attributes = new ArrayList<>();
            if (m.group("attributes") != null) {
                for (String piece : SourceText.parenSplit(',', m.group("attributes"))) {
                    String attribute = piece.strip().toLowerCase(Locale.ROOT).replace(" ", "");
                    if (attribute.isEmpty()) {
                        continue;
                    }
                    if (Permission.isPermission(attribute)) {
                        permission = Permission.parse(attribute);
                    } else if (attribute.equals("deferred")) {
                        deferred = true;
                    } else {
                        attributes.add(attribute);
                    }
                }
            }

            List<BoundProcedure> bound = new ArrayList<>();
            String names = m.group("names");
            if (generic) {
                int arrow = topLevelArrow(names);
                if (arrow < 0) {
                    throw error("GENERIC binding without targets in type '" + type.getName() + "'");
                }
                BoundProcedure binding = new BoundProcedure(names.substring(0, arrow).replaceAll("\\s+", ""),
                        type, permission, true);
                for (String target : SourceText.parenSplit(',', names.substring(arrow + 2))) {
                    if (!target.isBlank()) {
                        binding.bindings.add(Ref.unresolved(target.strip()));
                    }
                }
                bound.add(binding);
            } else {
                for (String piece : SourceText.parenSplit(',', names)) {
                    if (piece.isBlank()) {
                        continue;
                    }
                    int arrow = topLevelArrow(piece);
                    String name = (arrow < 0 ? piece : piece.substring(0, arrow)).strip();
                    String target = (arrow < 0 ? piece : piece.substring(arrow + 2)).strip();
                    BoundProcedure binding = new BoundProcedure(name, type, permission, false);
                    if (prototype != null) {
                        binding.prototype = Ref.unresolved(prototype);
                    } else {
                        binding.bindings.add(Ref.unresolved(target));
                    }
                    bound.add(binding);
                }
            }
            int line = reader.getLineNumber();
            for (BoundProcedure binding : bound) {
                binding.deferred = deferred;
                binding.attributes.addAll(attributes);
                binding.lineNumber = line;
            }
            type.boundProcedures.addAll(bound);
            readDocs(bound);
        }

        private void parseCall(ScopeState state, Matcher m) {
            Entity scope = state.scope;
            if (!(scope instanceof Program) && !(scope instanceof Procedure)
                    && !(scope instanceof ModuleProcedureImplementation)) {
                throw error("CALL statement in " + describe(scope));
            }
            List<String> chain = new ArrayList<>();
            for (String part : SourceText.parenSplit('%', m.group("chain"))) {
                String component = withoutArguments(part);
                if (!component.isEmpty()) {
                    chain.add(component);
                }
            }
            chain.add(m.group("name"));

            List<String> aliased = state.associations.isEmpty() ? null : lookupAssociation(state, chain.get(0));
            if (aliased != null) {
                List<String> expanded = new ArrayList<>(aliased);
                expanded.addAll(chain.subList(1, chain.size()));
                chain = expanded;
            }

            CallSite call = new CallSite(chain);
            CodeUnit unit = (CodeUnit) scope;
            for (CallSite existing : unit.calls) {
                if (existing.chainKey().equals(call.chainKey())) {
                    return;
                }
            }
            unit.calls.add(call);
        }

        private List<String> lookupAssociation(ScopeState state, String name) {
            String key = name.toLowerCase(Locale.ROOT);
            for (Map<String, List<String>> associations : state.associations) {
                List<String> target = associations.get(key);
                if (target != null) {
                    return target;
                }
            }
            return null;
        }

        private Map<String, List<String>> parseAssociations(String text) {
            Map<String, List<String>> associations = new HashMap<>();
            for (String piece : SourceText.parenSplit(',', text)) {
                int arrow = topLevelArrow(piece);
                if (arrow < 0) {
                    continue;
                }
                List<String> target = new ArrayList<>();
                for (String part : SourceText.parenSplit('%', piece.substring(arrow + 2))) {
                    String component = withoutArguments(part);
                    if (!component.isEmpty()) {
                        target.add(component);
                    }
                }
                if (!target.isEmpty()) {
                    associations.put(piece.substring(0, arrow).strip().toLowerCase(Locale.ROOT), target);
                }
            }
            return associations;
        }

        private void readDocs(List<? extends Entity> entities) {
            while (reader.hasNext()) {
                String next = reader.next();
                if (!marks.isDocLine(next)) {
                    reader.passBack(next);
                    return;
                }
                String doc = marks.docText(next);
                for (Entity entity : entities) {
                    entity.docLines.add(doc);
                }
            }
        }

        private void requireFileScope(ScopeState state, String statement) {
            if (!(state.scope instanceof SourceFile)) {
                throw error(statement + " statement inside " + describe(state.scope));
            }
        }

        private ParseException error(String message) {
            return new ParseException(file.getName(), reader.getLineNumber(), message);
        }
    }

    private static String endKeyword(Entity scope) {
        if (scope instanceof Submodule) {
            return "submodule";
        }
        if (scope instanceof Module) {
            return "module";
        }
        if (scope instanceof Program) {
            return "program";
        }
        if (scope instanceof BlockData) {
            return "blockdata";
        }
        if (scope instanceof Subroutine) {
            return "subroutine";
        }
        if (scope instanceof Function) {
            return "function";
        }
        if (scope instanceof ModuleProcedureImplementation) {
            return "procedure";
        }
        if (scope instanceof Interface) {
            return "interface";
        }
        if (scope instanceof DerivedType) {
            return "type";
        }
        if (scope instanceof Enumeration) {
            return "enum";
        }
        return null;
    }

    private static <T extends Entity> T findByName(List<T> entities, String name) {
        for (T entity : entities) {
            if (entity.getName().equalsIgnoreCase(name)) {
                return entity;
            }
        }
        return null;
    }

    private static boolean namesMatch(Entity scope, String endName) {
        if (scope instanceof Enumeration) {
            return true;
        }
        String compact = endName.replaceAll("\\s+", "");
        return compact.equalsIgnoreCase(scope.getName().replaceAll("\\s+", ""));
    }

    private static String describe(Entity scope) {
        if (scope instanceof SourceFile) {
            return "file scope";
        }
        return scope.getKind().getName() + " '" + scope.getName() + "'";
    }

    private static String withoutArguments(String part) {
        int paren = part.indexOf('(');
        return (paren >= 0 ? part.substring(0, paren) : part).strip();
    }

    private static int topLevelArrow(String text) {
        int depth = 0;
        for (int i = 0; i < text.length() - 1; i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == '=' && text.charAt(i + 1) == '>' && depth == 0) {
                return i;
            }
        }
        return -1;
    }
}
