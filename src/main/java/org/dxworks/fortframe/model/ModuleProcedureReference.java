package org.dxworks.fortframe.model;

/**
 * {@code module procedure name} inside a generic interface.
 */
public class ModuleProcedureReference extends Entity {
    public final Ref<Entity> procedure;

    public ModuleProcedureReference(String name, Entity parent, Permission permission) {
        super(name, parent, permission);
        this.procedure = Ref.unresolved(name);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.MODULE_PROCEDURE_REFERENCE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitModuleProcedureReference(this);
    }
}
