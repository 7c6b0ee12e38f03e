package org.dxworks.fortframe.model.summary;

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
import org.dxworks.fortframe.model.Procedure;
import org.dxworks.fortframe.model.Ref;
import org.dxworks.fortframe.model.SourceFile;
import org.dxworks.fortframe.model.Submodule;
import org.dxworks.fortframe.model.UseStatement;
import org.dxworks.fortframe.model.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens the correlated entity tree into the report records.
 */
public final class SummaryBuilder {

    private SummaryBuilder() {
    }

    public static UnitSummary unit(CodeUnit unit) {
        UnitSummary summary = new UnitSummary();
        summary.kind = unit.getKind().getName();
        summary.name = unit.getName();
        summary.file = unit.getSourceFile() == null ? null : unit.getSourceFile().path.toString();
        summary.url = unit.getUrl();
        summary.permission = unit.permission.getName();
        summary.metadata.putAll(unit.metadata);
        summary.doc = doc(unit);

        if (unit instanceof Module module) {
            summary.defaultAccess = module.defaultAccess.getName();
            for (ModuleProcedureImplementation implementation : module.modProcedures) {
                summary.moduleProcedures.add(implementation(implementation));
            }
            summary.exports.addAll(module.exports.procedures.keySet());
            summary.exports.addAll(module.exports.types.keySet());
            summary.exports.addAll(module.exports.absInterfaces.keySet());
            summary.exports.addAll(module.exports.variables.keySet());
            for (CodeUnit user : module.usedBy) {
                summary.usedBy.add(user.getName());
            }
            for (Submodule descendant : module.descendants) {
                summary.descendants.add(descendant.getName());
            }
        }
        if (unit instanceof Submodule submodule) {
            summary.ancestorModule = reference(submodule.ancestorModule);
            summary.parentSubmodule = submodule.parentSubmodule == null ? null : reference(submodule.parentSubmodule);
        }
        if (unit instanceof Procedure procedure) {
            summary.signature = procedure(procedure);
        }

        for (UseStatement use : unit.uses) {
            UseInfo info = new UseInfo();
            info.module = reference(use.module);
            info.clause = use.clause.isEmpty() ? null : use.clause;
            info.intrinsic = use.intrinsic;
            summary.uses.add(info);
        }
        for (Variable variable : unit.variables) {
            summary.variables.add(variable(variable));
        }
        for (Enumeration enumeration : unit.enums) {
            for (Variable enumerator : enumeration.variables) {
                summary.variables.add(variable(enumerator));
            }
        }
        for (DerivedType type : unit.types) {
            summary.types.add(type(type));
        }
        for (Procedure procedure : unit.procedures()) {
            summary.procedures.add(procedure(procedure));
        }
        for (Interface anInterface : unit.interfaces) {
            summary.interfaces.add(anInterface(anInterface));
        }
        for (Interface absInterface : unit.absInterfaces) {
            summary.absInterfaces.add(anInterface(absInterface));
        }
        for (CommonBlock block : unit.commonBlocks) {
            summary.commonBlocks.add(commonBlock(block));
        }
        for (Namelist namelist : unit.namelists) {
            summary.namelists.add(namelist(namelist));
        }
        return summary;
    }

    public static ProcedureInfo procedure(Procedure procedure) {
        ProcedureInfo info = new ProcedureInfo();
        info.kind = procedure.getKind().getName();
        info.name = procedure.getName();
        info.permission = procedure.permission.getName();
        info.url = procedure.getUrl();
        info.attributes.addAll(procedure.attributes);
        info.bindC = procedure.bindC;
        for (Entity argument : procedure.args) {
            if (argument instanceof Variable variable) {
                info.arguments.add(variable(variable));
            } else if (argument instanceof Procedure dummy) {
                info.procedureArguments.add(procedure(dummy));
            }
        }
        if (procedure instanceof Function function && function.result != null) {
            info.result = variable(function.result);
        }
        addCalls(procedure, info);
        if (procedure.separateInterface != null) {
            info.implementsInterface = reference(procedure.separateInterface);
        }
        info.doc = doc(procedure);
        return info;
    }

    private static ProcedureInfo implementation(ModuleProcedureImplementation implementation) {
        ProcedureInfo info = new ProcedureInfo();
        info.kind = implementation.getKind().getName();
        info.name = implementation.getName();
        info.permission = implementation.permission.getName();
        info.url = implementation.getUrl();
        Procedure declared = implementation.declaredProcedure();
        if (declared != null) {
            for (Entity argument : declared.args) {
                if (argument instanceof Variable variable) {
                    info.arguments.add(variable(variable));
                }
            }
            if (declared instanceof Function function && function.result != null) {
                info.result = variable(function.result);
            }
        }
        addCalls(implementation, info);
        info.implementsInterface = reference(implementation.interfaceRef);
        info.doc = doc(implementation);
        return info;
    }

    public static TypeSummary type(DerivedType type) {
        TypeSummary summary = new TypeSummary();
        summary.name = type.getName();
        summary.permission = type.permission.getName();
        summary.url = type.getUrl();
        summary.attributes.addAll(type.attributes);
        if (type.extendsType != null) {
            summary.extendsType = reference(type.extendsType);
        }
        for (DerivedType ancestor : type.ancestors()) {
            summary.ancestors.add(ancestor.getName());
        }
        summary.extensionCycle = type.extensionCycle ? Boolean.TRUE : null;
        for (Variable parameter : type.parameters) {
            summary.parameters.add(parameter.getName());
        }
        for (Variable component : type.variables) {
            summary.components.add(variable(component));
        }
        for (Variable inherited : type.inheritedVariables) {
            summary.inheritedComponents.add(inherited.getName());
        }
        for (BoundProcedure binding : type.boundProcedures) {
            summary.boundProcedures.add(binding(binding));
        }
        for (BoundProcedure binding : type.inheritedGenerics) {
            summary.boundProcedures.add(binding(binding));
        }
        for (BoundProcedure inherited : type.inheritedBoundProcedures) {
            summary.inheritedBindings.add(inherited.getName());
        }
        for (FinalProcedure finalProcedure : type.finalProcedures) {
            summary.finalProcedures.add(reference(finalProcedure.procedure));
        }
        if (type.constructor != null) {
            summary.constructor = reference(type.constructor);
        }
        for (DerivedType container : type.componentOf) {
            summary.componentOf.add(container.getName());
        }
        summary.doc = doc(type);
        return summary;
    }

    private static BindingInfo binding(BoundProcedure binding) {
        BindingInfo info = new BindingInfo();
        info.name = binding.getName();
        info.permission = binding.permission.getName();
        info.generic = binding.generic;
        info.deferred = binding.deferred ? Boolean.TRUE : null;
        info.attributes.addAll(binding.attributes);
        if (binding.prototype != null) {
            info.prototype = reference(binding.prototype);
        }
        for (Ref<Entity> target : binding.bindings) {
            info.bindings.add(reference(target));
        }
        return info;
    }

    private static InterfaceInfo anInterface(Interface anInterface) {
        InterfaceInfo info = new InterfaceInfo();
        info.name = anInterface.getName();
        info.permission = anInterface.permission.getName();
        info.url = anInterface.getUrl();
        info.generic = anInterface.generic;
        info.isAbstract = anInterface.isAbstract;
        if (anInterface.getProcedure() != null) {
            info.procedures.add(procedure(anInterface.getProcedure()));
        }
        for (Procedure member : anInterface.memberProcedures()) {
            info.procedures.add(procedure(member));
        }
        for (ModuleProcedureReference reference : anInterface.moduleProcedures) {
            info.moduleProcedures.add(reference(reference.procedure));
        }
        if (anInterface.implementation != null) {
            info.implementation = reference(anInterface.implementation);
        }
        info.doc = doc(anInterface);
        return info;
    }

    private static CommonBlockInfo commonBlock(CommonBlock block) {
        CommonBlockInfo info = new CommonBlockInfo();
        info.name = block.getName();
        info.url = block.getUrl();
        for (Variable member : block.variables) {
            info.variables.add(variable(member));
        }
        info.doc = doc(block);
        return info;
    }

    private static NamelistInfo namelist(Namelist namelist) {
        NamelistInfo info = new NamelistInfo();
        info.name = namelist.getName();
        info.permission = namelist.permission.getName();
        info.url = namelist.getUrl();
        for (Ref<Entity> member : namelist.variables) {
            info.variables.add(reference(member));
        }
        info.doc = doc(namelist);
        return info;
    }

    public static VariableInfo variable(Variable variable) {
        VariableInfo info = new VariableInfo();
        info.name = variable.getName();
        info.type = variable.fullType();
        info.permission = variable.permission.getName();
        info.attributes.addAll(variable.attributes);
        info.intent = variable.intent;
        info.dimension = variable.dimension;
        info.initial = variable.initial;
        info.optional = variable.optional ? Boolean.TRUE : null;
        info.parameter = variable.parameter ? Boolean.TRUE : null;
        info.implicitlyTyped = variable.implicitlyTyped ? Boolean.TRUE : null;
        if (variable.prototype != null) {
            info.prototype = reference(variable.prototype);
        }
        info.doc = doc(variable);
        return info;
    }

    public static ReferenceInfo reference(Ref<? extends Entity> ref) {
        ReferenceInfo info = new ReferenceInfo();
        info.name = ref.getName();
        info.resolved = ref.isResolved();
        ref.target().ifPresent(target -> {
            info.kind = target.getKind().getName();
            info.url = target.getUrl();
        });
        return info;
    }

    private static void addCalls(CodeUnit unit, ProcedureInfo info) {
        for (CallSite call : unit.calls) {
            CallInfo callInfo = new CallInfo();
            callInfo.call = String.join("%", call.chain);
            callInfo.target = reference(call.target);
            info.calls.add(callInfo);
        }
    }

    private static String doc(Entity entity) {
        String documentation = entity.getDocumentation();
        return documentation.isEmpty() ? null : documentation;
    }

    /**
     * Every module, submodule, program, block data unit and file-level procedure of the given files, in file order.
     */
    public static List<UnitSummary> units(List<SourceFile> files) {
        List<UnitSummary> summaries = new ArrayList<>();
        for (SourceFile file : files) {
            file.modules.forEach(module -> summaries.add(unit(module)));
            file.submodules.forEach(submodule -> summaries.add(unit(submodule)));
            file.programs.forEach(program -> summaries.add(unit(program)));
            file.blockData.forEach(blockData -> summaries.add(unit(blockData)));
            file.procedures().forEach(procedure -> summaries.add(unit(procedure)));
        }
        return summaries;
    }
}
