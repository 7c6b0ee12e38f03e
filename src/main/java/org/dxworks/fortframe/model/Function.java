package org.dxworks.fortframe.model;

import java.util.List;

public class Function extends Procedure {
    public final String resultName;
    public Variable result;

    public Function(String name, Entity parent, Permission permission, String resultName) {
        super(name, parent, permission);
        this.resultName = resultName == null ? name : resultName;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.FUNCTION;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public List<Entity> children() {
        List<Entity> children = super.children();
        if (result != null) {
            children.add(result);
        }
        return children;
    }
}
