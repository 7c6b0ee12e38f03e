package org.dxworks.fortframe.model;

public class FinalProcedure extends Entity {
    public final Ref<Entity> procedure;

    public FinalProcedure(String name, Entity parent, Permission permission) {
        super(name, parent, permission);
        this.procedure = Ref.unresolved(name);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.FINAL_PROCEDURE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitFinalProcedure(this);
    }
}
