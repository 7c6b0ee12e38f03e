package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * An interface block. A generic interface has a name and members; an abstract or anonymous block is split into
 * one non-generic interface per procedure it declares, each wrapping exactly that procedure.
 */
public class Interface extends Entity {
    public final boolean generic;
    public final boolean isAbstract;
    public List<Subroutine> subroutines = new ArrayList<>();
    public List<Function> functions = new ArrayList<>();
    public List<ModuleProcedureReference> moduleProcedures = new ArrayList<>();
    public List<Variable> variables = new ArrayList<>();
    private Procedure procedure;
    /** For a separate module procedure interface, the body that implements it. */
    public Ref<Entity> implementation;

    public Interface(String name, Entity parent, Permission permission, boolean generic, boolean isAbstract) {
        super(name, parent, permission);
        this.generic = generic;
        this.isAbstract = isAbstract;
    }

    /**
     * Wraps one procedure of an abstract or anonymous interface block.
     */
    public static Interface wrapping(Procedure procedure, Interface block) {
        Interface wrapper = new Interface(procedure.getName(), block.parent, block.permission, false, block.isAbstract);
        wrapper.procedure = procedure;
        wrapper.lineNumber = procedure.lineNumber;
        wrapper.docLines.addAll(block.docLines);
        procedure.parent = wrapper;
        return wrapper;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.INTERFACE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitInterface(this);
    }

    @Override
    public List<Entity> children() {
        if (procedure != null) {
            return List.of(procedure);
        }
        return concat(subroutines, functions, moduleProcedures, variables);
    }

    public Procedure getProcedure() {
        return procedure;
    }

    /**
     * Removes the wrapped procedure so it can serve as a procedure argument on its own.
     */
    public Procedure unwrap(Entity newParent) {
        Procedure unwrapped = procedure;
        procedure = null;
        unwrapped.parent = newParent;
        return unwrapped;
    }

    public List<Procedure> memberProcedures() {
        List<Procedure> members = new ArrayList<>(functions);
        members.addAll(subroutines);
        return members;
    }

    @Override
    public void freeze() {
        super.freeze();
        subroutines = frozen(subroutines);
        functions = frozen(functions);
        moduleProcedures = frozen(moduleProcedures);
        variables = frozen(variables);
    }
}
