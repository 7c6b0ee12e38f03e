package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.model.CodeUnit;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.DocMetadata;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.Interface;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.ModuleProcedureImplementation;
import org.dxworks.fortframe.model.Permission;
import org.dxworks.fortframe.model.Procedure;
import org.dxworks.fortframe.model.SourceFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Drops the entities that are not displayed: those whose permission is outside the display set, undocumented
 * ones when {@code hideUndoc} is set, and the internals of procedures unless they are asked for. Documentation
 * metadata can change the display set and the internals setting for an entity and its children.
 */
final class Pruner {

    private final Set<Permission> display;
    private final boolean hideUndoc;
    private final boolean procInternals;

    Pruner(Set<Permission> display, boolean hideUndoc, boolean procInternals) {
        this.display = display;
        this.hideUndoc = hideUndoc;
        this.procInternals = procInternals;
    }

    void prune(SourceFile file) {
        List<CodeUnit> units = new ArrayList<>(file.modules);
        units.addAll(file.submodules);
        units.addAll(file.programs);
        units.addAll(file.blockData);
        units.addAll(file.procedures());
        for (CodeUnit unit : units) {
            pruneUnit(unit, display, procInternals);
        }
    }

    private void pruneUnit(CodeUnit unit, Set<Permission> inheritedDisplay, boolean inheritedInternals) {
        Set<Permission> shown = DocMetadata.display(unit).orElse(inheritedDisplay);
        boolean internals = DocMetadata.procInternals(unit).orElse(inheritedInternals);

        if ((unit instanceof Procedure || unit instanceof ModuleProcedureImplementation) && !internals) {
            unit.variables.clear();
            unit.types.clear();
            unit.enums.clear();
            unit.functions.clear();
            unit.subroutines.clear();
            unit.interfaces.clear();
            unit.absInterfaces.clear();
            unit.commonBlocks.clear();
            unit.namelists.clear();
            return;
        }

        filter(unit.functions, shown);
        filter(unit.subroutines, shown);
        filter(unit.types, shown);
        filter(unit.enums, shown);
        filter(unit.interfaces, shown);
        filter(unit.absInterfaces, shown);
        filter(unit.variables, shown);
        if (unit instanceof Module module) {
            filter(module.modProcedures, shown);
            for (ModuleProcedureImplementation implementation : module.modProcedures) {
                pruneUnit(implementation, shown, internals);
            }
        }

        for (Procedure procedure : unit.procedures()) {
            pruneUnit(procedure, shown, internals);
        }
        for (DerivedType type : unit.types) {
            pruneType(type, shown);
        }
        List<Interface> interfaces = new ArrayList<>(unit.interfaces);
        interfaces.addAll(unit.absInterfaces);
        for (Interface anInterface : interfaces) {
            if (anInterface.getProcedure() != null) {
                pruneUnit(anInterface.getProcedure(), shown, internals);
            }
            for (Procedure member : anInterface.memberProcedures()) {
                pruneUnit(member, shown, internals);
            }
        }
    }

    private void pruneType(DerivedType type, Set<Permission> inheritedDisplay) {
        Set<Permission> shown = DocMetadata.display(type).orElse(inheritedDisplay);
        filter(type.variables, shown);
        filter(type.boundProcedures, shown);
        filter(type.inheritedGenerics, shown);
    }

    private <T extends Entity> void filter(List<T> entities, Set<Permission> shown) {
        entities.removeIf(entity -> !shouldDisplay(entity, shown));
    }

    private boolean shouldDisplay(Entity entity, Set<Permission> shown) {
        if (hideUndoc && !entity.hasDocumentation()) {
            return false;
        }
        return shown.contains(entity.permission);
    }
}
