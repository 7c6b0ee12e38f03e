package org.dxworks.fortframe.model;

public class Program extends CodeUnit {

    public Program(String name, Entity parent) {
        super(name, parent, Permission.PUBLIC);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.PROGRAM;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitProgram(this);
    }
}
