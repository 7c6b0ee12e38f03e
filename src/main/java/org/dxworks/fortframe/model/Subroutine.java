package org.dxworks.fortframe.model;

public class Subroutine extends Procedure {

    public Subroutine(String name, Entity parent, Permission permission) {
        super(name, parent, permission);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.SUBROUTINE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitSubroutine(this);
    }
}
