package org.dxworks.fortframe.model;

/**
 * A {@code module procedure name} body. Its arguments are those of the interface it implements.
 */
public class ModuleProcedureImplementation extends CodeUnit {
    public final Ref<Interface> interfaceRef;

    public ModuleProcedureImplementation(String name, Entity parent, Permission permission) {
        super(name, parent, permission);
        this.interfaceRef = Ref.unresolved(name);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.MODULE_PROCEDURE_IMPLEMENTATION;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitModuleProcedureImplementation(this);
    }

    public Procedure declaredProcedure() {
        return interfaceRef.target().map(Interface::getProcedure).orElse(null);
    }
}
