package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.model.BlockData;
import org.dxworks.fortframe.model.BoundProcedure;
import org.dxworks.fortframe.model.CallSite;
import org.dxworks.fortframe.model.CodeUnit;
import org.dxworks.fortframe.model.CommonBlock;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.EntityVisitor;
import org.dxworks.fortframe.model.Enumeration;
import org.dxworks.fortframe.model.ExternalModule;
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
import org.dxworks.fortframe.model.ScopeTables;
import org.dxworks.fortframe.model.SourceFile;
import org.dxworks.fortframe.model.Subroutine;
import org.dxworks.fortframe.model.Submodule;
import org.dxworks.fortframe.model.UseStatement;
import org.dxworks.fortframe.model.Variable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Correlates one entity and everything it owns. Units must be visited in dependency order: the export tables of
 * used modules and the tables of ancestor modules are read, never written.
 * <p>
 * The visible tables of a unit are merged in this order, first entry winning: local declarations, host scope,
 * submodule ancestry, used modules.
 */
final class ScopeCorrelator implements EntityVisitor<Void> {

    private final Diagnostics diagnostics;
    private final ChainResolver chains;

    ScopeCorrelator(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
        this.chains = new ChainResolver(diagnostics);
    }

    @Override
    public Void visitSourceFile(SourceFile file) {
        for (Entity child : file.children()) {
            child.accept(this);
        }
        return null;
    }

    @Override
    public Void visitModule(Module module) {
        correlateUnit(module);
        return null;
    }

    @Override
    public Void visitSubmodule(Submodule submodule) {
        correlateUnit(submodule);
        return null;
    }

    @Override
    public Void visitExternalModule(ExternalModule module) {
        return null;
    }

    @Override
    public Void visitProgram(Program program) {
        correlateUnit(program);
        return null;
    }

    @Override
    public Void visitBlockData(BlockData blockData) {
        correlateUnit(blockData);
        return null;
    }

    @Override
    public Void visitSubroutine(Subroutine subroutine) {
        correlateUnit(subroutine);
        return null;
    }

    @Override
    public Void visitFunction(Function function) {
        correlateUnit(function);
        return null;
    }

    @Override
    public Void visitModuleProcedureImplementation(ModuleProcedureImplementation implementation) {
        correlateUnit(implementation);
        return null;
    }

    @Override
    public Void visitInterface(Interface anInterface) {
        if (!anInterface.generic) {
            if (anInterface.getProcedure() != null) {
                anInterface.getProcedure().accept(this);
            }
            return null;
        }
        for (ModuleProcedureReference reference : anInterface.moduleProcedures) {
            reference.accept(this);
        }
        for (Procedure member : anInterface.memberProcedures()) {
            member.accept(this);
        }
        for (Variable variable : anInterface.variables) {
            variable.accept(this);
        }
        return null;
    }

    @Override
    public Void visitDerivedType(DerivedType type) {
        for (Variable parameter : type.parameters) {
            parameter.accept(this);
        }
        for (Variable component : type.variables) {
            component.accept(this);
            if (component.prototype != null
                    && component.prototype.target().orElse(null) instanceof DerivedType componentType) {
                componentType.addComponentOf(type);
            }
        }
        if (type.extendsType != null && type.extendsType.isResolved() && !type.extensionCycle) {
            inherit(type, type.extendsType.get());
        }
        for (BoundProcedure binding : type.boundProcedures) {
            if (!binding.generic) {
                binding.accept(this);
            }
        }
        for (BoundProcedure binding : type.boundProcedures) {
            if (binding.generic) {
                binding.accept(this);
            }
        }
        for (BoundProcedure binding : type.inheritedGenerics) {
            binding.accept(this);
        }
        for (FinalProcedure finalProcedure : type.finalProcedures) {
            finalProcedure.accept(this);
        }
        Entity constructor = tablesOf(type).procedures.get(ScopeTables.key(type.getName()));
        if (constructor != null) {
            type.constructor = Ref.resolved(constructor);
        }
        return null;
    }

    @Override
    public Void visitEnumeration(Enumeration enumeration) {
        return null;
    }

    @Override
    public Void visitVariable(Variable variable) {
        if (variable.prototype == null || variable.prototype.isResolved() || variable.prototype.getName().equals("*")) {
            return null;
        }
        ScopeTables tables = tablesOf(variable);
        String key = ScopeTables.key(variable.prototype.getName());
        Entity target;
        if (variable.isProcedurePointer()) {
            target = tables.absInterfaces.get(key);
            if (target == null) {
                target = tables.procedures.get(key);
            }
        } else {
            target = tables.types.get(key);
        }
        if (target == null) {
            diagnostics.warn("Could not find " + variable.vartype + " '" + variable.prototype.getName()
                    + "' of variable '" + variable.getName() + "'");
            return null;
        }
        variable.prototype.resolve(target);
        return null;
    }

    @Override
    public Void visitCommonBlock(CommonBlock commonBlock) {
        for (Variable variable : commonBlock.variables) {
            variable.accept(this);
        }
        return null;
    }

    @Override
    public Void visitNamelist(Namelist namelist) {
        ScopeTables tables = tablesOf(namelist);
        for (Ref<Entity> member : namelist.variables) {
            if (member.isResolved()) {
                continue;
            }
            Entity variable = tables.variables.get(ScopeTables.key(member.getName()));
            if (variable == null) {
                diagnostics.warn("Could not find variable '" + member.getName() + "' of namelist '"
                        + namelist.getName() + "'");
            } else {
                member.resolve(variable);
            }
        }
        return null;
    }

    @Override
    public Void visitBoundProcedure(BoundProcedure binding) {
        if (binding.generic) {
            DerivedType type = (DerivedType) binding.parent;
            for (Ref<Entity> target : binding.bindings) {
                if (target.isResolved()) {
                    continue;
                }
                BoundProcedure specific = findSpecific(type, target.getName());
                if (specific == null) {
                    diagnostics.warn("Could not find binding '" + target.getName() + "' of generic '"
                            + binding.getName() + "' in type '" + type.getName() + "'");
                } else {
                    target.resolve(specific);
                }
            }
            return null;
        }

        ScopeTables tables = tablesOf(binding);
        if (binding.prototype != null && !binding.prototype.isResolved()) {
            String key = ScopeTables.key(binding.prototype.getName());
            Entity prototype = tables.absInterfaces.get(key);
            if (prototype == null) {
                prototype = tables.procedures.get(key);
            }
            if (prototype == null) {
                diagnostics.warn("Could not find interface '" + binding.prototype.getName()
                        + "' of bound procedure '" + binding.getName() + "'");
            } else {
                binding.prototype.resolve(prototype);
            }
        }
        for (Ref<Entity> target : binding.bindings) {
            if (target.isResolved()) {
                continue;
            }
            Entity procedure = tables.procedures.get(ScopeTables.key(target.getName()));
            if (procedure == null) {
                diagnostics.warn("Could not find procedure '" + target.getName() + "' bound to '"
                        + binding.getName() + "' in type '" + binding.parent.getName() + "'");
            } else {
                target.resolve(procedure);
            }
        }
        return null;
    }

    @Override
    public Void visitModuleProcedureReference(ModuleProcedureReference reference) {
        Entity procedure = tablesOf(reference).procedures.get(ScopeTables.key(reference.getName()));
        if (procedure == null || procedure == reference.parent) {
            diagnostics.warn("Could not find module procedure '" + reference.getName() + "' of interface '"
                    + reference.parent.getName() + "'");
            return null;
        }
        reference.procedure.resolve(procedure);
        return null;
    }

    @Override
    public Void visitFinalProcedure(FinalProcedure finalProcedure) {
        Entity procedure = tablesOf(finalProcedure).procedures.get(ScopeTables.key(finalProcedure.getName()));
        if (procedure == null) {
            diagnostics.warn("Could not find final procedure '" + finalProcedure.getName() + "' of type '"
                    + finalProcedure.parent.getName() + "'");
            return null;
        }
        finalProcedure.procedure.resolve(procedure);
        return null;
    }

    private void correlateUnit(CodeUnit unit) {
        buildVisible(unit);
        if (unit instanceof Module module) {
            if (!(unit instanceof Submodule)) {
                computeExports(module);
            }
            linkSeparateProcedures(module);
        }

        correlateTypes(unit);
        for (Variable variable : unit.variables) {
            variable.accept(this);
        }
        for (CommonBlock commonBlock : unit.commonBlocks) {
            commonBlock.accept(this);
        }
        if (unit instanceof Procedure procedure) {
            for (Entity argument : procedure.args) {
                argument.accept(this);
            }
            if (procedure instanceof Function function && function.result != null) {
                function.result.accept(this);
            }
        }
        for (Namelist namelist : unit.namelists) {
            namelist.accept(this);
        }
        for (Interface anInterface : unit.interfaces) {
            anInterface.accept(this);
        }
        for (Interface absInterface : unit.absInterfaces) {
            absInterface.accept(this);
        }
        for (CallSite call : unit.calls) {
            chains.resolve(call, unit);
        }
        for (Procedure procedure : unit.procedures()) {
            procedure.accept(this);
        }
        if (unit instanceof Module module) {
            for (ModuleProcedureImplementation implementation : module.modProcedures) {
                implementation.accept(this);
            }
        }
    }

    private void buildVisible(CodeUnit unit) {
        ScopeTables visible = unit.visible;
        addLocal(unit, visible);

        CodeUnit host = hostOf(unit);
        if (host != null) {
            visible.mergeFrom(host.visible);
        }

        if (unit instanceof Submodule submodule) {
            for (Submodule parent : submodule.ancestry()) {
                visible.mergeFrom(parent.visible);
            }
            submodule.ancestorModule.target().ifPresent(ancestor -> {
                visible.mergeFrom(ancestor.visible);
                ancestor.addDescendant(submodule);
            });
        }

        for (UseStatement use : unit.uses) {
            use.module.target().ifPresent(module -> {
                module.addUser(unit);
                if (!module.isExternal()) {
                    visible.mergeFrom(UseClause.parse(use.clause).apply(module.exports));
                }
            });
        }
    }

    private static void addLocal(CodeUnit unit, ScopeTables tables) {
        for (Procedure procedure : unit.procedures()) {
            if (!procedure.separateModuleProcedure) {
                tables.addProcedure(procedure);
            }
        }
        for (Interface anInterface : unit.interfaces) {
            tables.addProcedure(anInterface);
        }
        for (DerivedType type : unit.types) {
            tables.addType(type);
        }
        for (Interface absInterface : unit.absInterfaces) {
            tables.addAbsInterface(absInterface);
        }
        for (Variable variable : unit.variables) {
            tables.addVariable(variable);
        }
        for (CommonBlock commonBlock : unit.commonBlocks) {
            for (Variable member : commonBlock.variables) {
                tables.addVariable(member);
            }
        }
        for (Enumeration enumeration : unit.enums) {
            for (Variable enumerator : enumeration.variables) {
                tables.addVariable(enumerator);
            }
        }
        if (unit instanceof Procedure procedure) {
            for (Entity argument : procedure.args) {
                if (argument instanceof Procedure dummyProcedure) {
                    tables.addProcedure(dummyProcedure);
                } else {
                    tables.addVariable(argument);
                }
            }
            if (procedure instanceof Function function && function.result != null) {
                tables.addVariable(function.result);
            }
        }
    }

    /**
     * Public and protected declarations of the module, then whatever its use statements bring in that the
     * module does not make private.
     */
    private static void computeExports(Module module) {
        ScopeTables local = new ScopeTables();
        addLocal(module, local);
        exportOwn(local.procedures, module.exports.procedures);
        exportOwn(local.types, module.exports.types);
        exportOwn(local.absInterfaces, module.exports.absInterfaces);
        exportOwn(local.variables, module.exports.variables);

        for (UseStatement use : module.uses) {
            Module used = use.module.target().orElse(null);
            if (used == null || used.isExternal()) {
                continue;
            }
            ScopeTables imported = UseClause.parse(use.clause).apply(used.exports);
            exportUsed(module, imported.procedures, module.exports.procedures);
            exportUsed(module, imported.types, module.exports.types);
            exportUsed(module, imported.absInterfaces, module.exports.absInterfaces);
            exportUsed(module, imported.variables, module.exports.variables);
        }
    }

    private static <T extends Entity> void exportOwn(Map<String, T> local, Map<String, T> exports) {
        local.forEach((key, entity) -> {
            if (entity.permission != Permission.PRIVATE) {
                exports.putIfAbsent(key, entity);
            }
        });
    }

    private static <T extends Entity> void exportUsed(Module module, Map<String, T> imported, Map<String, T> exports) {
        imported.forEach((key, entity) -> {
            if (module.shouldExport(key)) {
                exports.putIfAbsent(key, entity);
            }
        });
    }

    private void linkSeparateProcedures(Module module) {
        for (ModuleProcedureImplementation implementation : module.modProcedures) {
            Interface declaration = separateInterface(module, implementation.getName());
            if (declaration == null) {
                diagnostics.warn("Could not find the interface of MODULE PROCEDURE '" + implementation.getName()
                        + "' in " + module.getKind().getName() + " '" + module.getName() + "'");
                continue;
            }
            implementation.interfaceRef.resolve(declaration);
            if (declaration.implementation == null) {
                declaration.implementation = Ref.resolved(implementation);
            }
        }
        for (Procedure procedure : module.procedures()) {
            if (!procedure.separateModuleProcedure) {
                continue;
            }
            if (procedure.separateInterface == null) {
                procedure.separateInterface = Ref.unresolved(procedure.getName());
            }
            Interface declaration = separateInterface(module, procedure.getName());
            if (declaration == null) {
                diagnostics.warn("Could not find the interface of separate module procedure '"
                        + procedure.getName() + "' in " + module.getKind().getName() + " '" + module.getName() + "'");
                continue;
            }
            procedure.separateInterface.resolve(declaration);
            if (declaration.implementation == null) {
                declaration.implementation = Ref.resolved(procedure);
            }
        }
    }

    private static Interface separateInterface(Module module, String name) {
        Entity candidate = module.visible.procedures.get(ScopeTables.key(name));
        if (candidate instanceof Interface declaration && declaration.getProcedure() != null) {
            return declaration;
        }
        return null;
    }

    private void correlateTypes(CodeUnit unit) {
        for (DerivedType type : unit.types) {
            if (type.extendsType == null || type.extendsType.isResolved()) {
                continue;
            }
            DerivedType parent = unit.visible.types.get(ScopeTables.key(type.extendsType.getName()));
            if (parent == null) {
                diagnostics.warn("Could not find type '" + type.extendsType.getName() + "' extended by '"
                        + type.getName() + "'");
            } else {
                type.extendsType.resolve(parent);
            }
        }
        for (DerivedType type : unit.types) {
            flagExtensionCycle(type);
        }
        List<DerivedType> ordered = new ArrayList<>();
        Set<DerivedType> visiting = new HashSet<>();
        for (DerivedType type : unit.types) {
            orderByExtension(type, unit.types, visiting, ordered);
        }
        for (DerivedType type : ordered) {
            type.accept(this);
        }
    }

    private void flagExtensionCycle(DerivedType type) {
        Set<DerivedType> seen = new HashSet<>();
        Ref<DerivedType> next = type.extendsType;
        while (next != null && next.isResolved()) {
            DerivedType ancestor = next.get();
            if (ancestor == type) {
                type.extensionCycle = true;
                diagnostics.warn("Type '" + type.getName() + "' extends itself through its ancestors");
                return;
            }
            if (!seen.add(ancestor)) {
                return;
            }
            next = ancestor.extendsType;
        }
    }

    private static void orderByExtension(DerivedType type, List<DerivedType> local, Set<DerivedType> visiting,
                                         List<DerivedType> ordered) {
        if (ordered.contains(type) || !visiting.add(type)) {
            return;
        }
        if (type.extendsType != null && type.extendsType.isResolved() && local.contains(type.extendsType.get())) {
            orderByExtension(type.extendsType.get(), local, visiting, ordered);
        }
        ordered.add(type);
    }

    /**
     * Components and bindings of {@code parent} that {@code type} does not override.
     */
    private static void inherit(DerivedType type, DerivedType parent) {
        Set<String> own = new HashSet<>();
        for (Variable component : type.variables) {
            own.add(component.getLowerName());
        }
        for (Variable component : parent.allComponents()) {
            if (component.permission != Permission.PRIVATE && own.add(component.getLowerName())) {
                type.inheritedVariables.add(component);
            }
        }

        Set<String> ownBindings = new LinkedHashSet<>();
        for (BoundProcedure binding : type.boundProcedures) {
            ownBindings.add(binding.getLowerName());
        }
        for (BoundProcedure inherited : parent.allBoundProcedures()) {
            if (inherited.permission == Permission.PRIVATE) {
                continue;
            }
            if (!inherited.generic) {
                if (ownBindings.add(inherited.getLowerName())) {
                    type.inheritedBoundProcedures.add(inherited);
                }
                continue;
            }
            BoundProcedure ownGeneric = findGeneric(type.boundProcedures, inherited.getName());
            if (ownGeneric != null) {
                for (Ref<Entity> target : inherited.bindings) {
                    if (!hasBinding(ownGeneric, target.getName())) {
                        ownGeneric.bindings.add(Ref.unresolved(target.getName()));
                    }
                }
            } else if (findGeneric(type.inheritedGenerics, inherited.getName()) == null) {
                type.inheritedGenerics.add(inherited.copyFor(type));
            }
        }
    }

    private static BoundProcedure findSpecific(DerivedType type, String name) {
        for (BoundProcedure binding : type.boundProcedures) {
            if (!binding.generic && binding.getName().equalsIgnoreCase(name)) {
                return binding;
            }
        }
        for (BoundProcedure binding : type.inheritedBoundProcedures) {
            if (binding.getName().equalsIgnoreCase(name)) {
                return binding;
            }
        }
        return null;
    }

    private static BoundProcedure findGeneric(List<BoundProcedure> bindings, String name) {
        for (BoundProcedure binding : bindings) {
            if (binding.generic && binding.getName().equalsIgnoreCase(name)) {
                return binding;
            }
        }
        return null;
    }

    private static boolean hasBinding(BoundProcedure generic, String name) {
        for (Ref<Entity> target : generic.bindings) {
            if (target.getName().equalsIgnoreCase(name)) {
                return true;
            }
        }
        return false;
    }

    private static CodeUnit hostOf(Entity entity) {
        Entity current = entity.parent;
        while (current != null && !(current instanceof CodeUnit)) {
            current = current.parent;
        }
        return (CodeUnit) current;
    }

    /**
     * Visible tables of the innermost code unit that contains {@code entity}.
     */
    private static ScopeTables tablesOf(Entity entity) {
        CodeUnit unit = entity instanceof CodeUnit self ? self : hostOf(entity);
        return unit == null ? new ScopeTables() : unit.visible;
    }
}
