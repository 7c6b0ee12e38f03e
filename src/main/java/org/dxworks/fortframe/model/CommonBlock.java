package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One named or blank ({@code name} empty) common block as declared by the {@code common} statements of a unit.
 * The member variables move here from the unit when its scope is closed; members without a declaration are typed
 * by the legacy first-letter rule.
 */
public class CommonBlock extends Entity {
    /** Members as written, e.g. {@code x(10)}. */
    public List<String> memberNames = new ArrayList<>();
    public List<Variable> variables = new ArrayList<>();

    public CommonBlock(String name, Entity parent) {
        super(name, parent, Permission.PUBLIC);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.COMMON_BLOCK;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitCommonBlock(this);
    }

    @Override
    public List<Entity> children() {
        return new ArrayList<>(variables);
    }

    public boolean isBlank() {
        return name.isEmpty();
    }

    @Override
    public void freeze() {
        super.freeze();
        memberNames = frozen(memberNames);
        variables = frozen(variables);
    }
}
