package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.model.CodeUnit;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.ExternalModule;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.SourceFile;
import org.dxworks.fortframe.model.Submodule;
import org.dxworks.fortframe.model.UseStatement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves {@code use} statements and submodule ancestry against the modules of the project, then against the
 * external module table.
 */
final class ModuleResolver {

    private final Map<String, Module> modules = new LinkedHashMap<>();
    private final Map<String, Submodule> submodules = new LinkedHashMap<>();
    private final Map<String, ExternalModule> externals;
    private final List<ExternalModule> usedExternals = new ArrayList<>();
    private final Diagnostics diagnostics;

    ModuleResolver(List<SourceFile> files, Map<String, ExternalModule> externals, Diagnostics diagnostics) {
        this.externals = externals;
        this.diagnostics = diagnostics;
        for (SourceFile file : files) {
            for (Module module : file.modules) {
                Module previous = modules.putIfAbsent(module.getLowerName(), module);
                if (previous != null) {
                    diagnostics.warn("Module '" + module.getName() + "' in " + file.getName()
                            + " has the name of a module in " + previous.getSourceFile().getName()
                            + "; the first one is used");
                }
            }
            for (Submodule submodule : file.submodules) {
                submodules.putIfAbsent(submoduleKey(submodule.ancestorModule.getName(), submodule.getName()), submodule);
            }
        }
    }

    void resolve(SourceFile file) {
        resolveUses(file);
        for (Submodule submodule : file.submodules) {
            resolveAncestry(submodule);
        }
    }

    /**
     * External modules that some {@code use} statement resolved to, in order of first use.
     */
    List<ExternalModule> getUsedExternals() {
        return usedExternals;
    }

    private void resolveUses(Entity entity) {
        if (entity instanceof CodeUnit unit) {
            for (UseStatement use : unit.uses) {
                resolveUse(unit, use);
            }
        }
        for (Entity child : entity.children()) {
            resolveUses(child);
        }
    }

    private void resolveUse(CodeUnit unit, UseStatement use) {
        String name = use.getModuleName().toLowerCase(Locale.ROOT);
        Module module = use.intrinsic ? null : modules.get(name);
        if (module == null) {
            ExternalModule external = externals.get(name);
            if (external != null && !usedExternals.contains(external)) {
                usedExternals.add(external);
            }
            module = external;
        }
        if (module == null) {
            diagnostics.warn("Could not identify module '" + use.getModuleName() + "' used in "
                    + unit.getKind().getName() + " '" + unit.getName() + "'");
            return;
        }
        use.module.resolve(module);
    }

    private void resolveAncestry(Submodule submodule) {
        Module ancestor = modules.get(submodule.ancestorModule.getLowerName());
        if (ancestor == null) {
            diagnostics.warn("Could not identify ancestor MODULE '" + submodule.ancestorModule.getName()
                    + "' of SUBMODULE '" + submodule.getName() + "'");
        } else {
            submodule.ancestorModule.resolve(ancestor);
        }
        if (submodule.parentSubmodule == null) {
            return;
        }
        Submodule parent = submodules.get(
                submoduleKey(submodule.ancestorModule.getName(), submodule.parentSubmodule.getName()));
        if (parent == null || parent == submodule) {
            diagnostics.warn("Could not identify parent SUBMODULE '" + submodule.parentSubmodule.getName()
                    + "' of SUBMODULE '" + submodule.getName() + "'");
        } else {
            submodule.parentSubmodule.resolve(parent);
        }
    }

    private static String submoduleKey(String ancestor, String name) {
        return (ancestor + ":" + name).toLowerCase(Locale.ROOT);
    }
}
