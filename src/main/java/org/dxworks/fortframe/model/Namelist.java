package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code namelist} group. Its members are references to variables visible in the declaring unit, dummy
 * arguments included.
 */
public class Namelist extends Entity {
    public List<Ref<Entity>> variables = new ArrayList<>();

    public Namelist(String name, Entity parent, Permission permission) {
        super(name, parent, permission);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.NAMELIST;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitNamelist(this);
    }

    @Override
    public void freeze() {
        super.freeze();
        variables = frozen(variables);
    }
}
