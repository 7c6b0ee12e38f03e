package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

public class Enumeration extends Entity {
    public final boolean bindC;
    public List<Variable> variables = new ArrayList<>();

    public Enumeration(Entity parent, Permission permission, boolean bindC) {
        super("enum", parent, permission);
        this.bindC = bindC;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.ENUMERATION;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitEnumeration(this);
    }

    @Override
    public List<Entity> children() {
        return new ArrayList<>(variables);
    }

    @Override
    public void freeze() {
        super.freeze();
        variables = frozen(variables);
    }
}
