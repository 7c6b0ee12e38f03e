package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A scope that owns declarations: module, submodule, program, block data unit, procedure or separate module
 * procedure body.
 */
public abstract class CodeUnit extends Entity {
    public List<Variable> variables = new ArrayList<>();
    public List<DerivedType> types = new ArrayList<>();
    public List<Function> functions = new ArrayList<>();
    public List<Subroutine> subroutines = new ArrayList<>();
    public List<Interface> interfaces = new ArrayList<>();
    public List<Interface> absInterfaces = new ArrayList<>();
    public List<Enumeration> enums = new ArrayList<>();
    public List<CommonBlock> commonBlocks = new ArrayList<>();
    public List<Namelist> namelists = new ArrayList<>();
    public List<UseStatement> uses = new ArrayList<>();
    public List<CallSite> calls = new ArrayList<>();

    /** Lower-cased names given a {@code public} attribute in this scope, including names brought in by use. */
    public Set<String> publicNames = new LinkedHashSet<>();
    /** Lower-cased names given a {@code private} attribute in this scope. */
    public Set<String> privateNames = new LinkedHashSet<>();

    /** Everything visible in this scope, filled in during correlation. */
    public final ScopeTables visible = new ScopeTables();

    protected CodeUnit(String name, Entity parent, Permission permission) {
        super(name, parent, permission);
    }

    @Override
    public List<Entity> children() {
        return concat(variables, commonBlocks, namelists, types, enums, functions, subroutines, interfaces,
                absInterfaces);
    }

    public List<Procedure> procedures() {
        List<Procedure> procedures = new ArrayList<>(functions);
        procedures.addAll(subroutines);
        return procedures;
    }

    public List<Module> usedModules() {
        List<Module> modules = new ArrayList<>();
        for (UseStatement use : uses) {
            use.module.target().filter(module -> !modules.contains(module)).ifPresent(modules::add);
        }
        return modules;
    }

    @Override
    public void freeze() {
        super.freeze();
        variables = frozen(variables);
        types = frozen(types);
        functions = frozen(functions);
        subroutines = frozen(subroutines);
        interfaces = frozen(interfaces);
        absInterfaces = frozen(absInterfaces);
        enums = frozen(enums);
        commonBlocks = frozen(commonBlocks);
        namelists = frozen(namelists);
        uses = frozen(uses);
        calls = frozen(calls);
        publicNames = Collections.unmodifiableSet(new LinkedHashSet<>(publicNames));
        privateNames = Collections.unmodifiableSet(new LinkedHashSet<>(privateNames));
    }
}
