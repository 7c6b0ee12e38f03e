package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A declared variable, component, dummy argument or function result.
 */
public class Variable extends Entity {
    public String vartype;
    public String kind;
    public String strlen;
    /** For {@code type(...)}, {@code class(...)} and {@code procedure(...)} declarations, the named entity. */
    public Ref<Entity> prototype;
    public List<String> attributes = new ArrayList<>();
    public String intent;
    public boolean optional;
    public boolean parameter;
    public boolean points;
    public String initial;
    public String dimension;
    /** Typed by the first-letter rule because no declaration was found. */
    public boolean implicitlyTyped;

    public Variable(String name, Entity parent, Permission permission, String vartype) {
        super(name, parent, permission);
        this.vartype = vartype;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.VARIABLE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    public boolean isProcedurePointer() {
        return "procedure".equals(vartype);
    }

    /**
     * The full type as it would be declared, e.g. {@code real(kind=dp)} or {@code type(point)}.
     */
    public String fullType() {
        StringBuilder type = new StringBuilder(vartype);
        if (prototype != null) {
            type.append('(').append(prototype.getName()).append(')');
        } else if (kind != null && strlen != null) {
            type.append("(len=").append(strlen).append(", kind=").append(kind).append(')');
        } else if (kind != null) {
            type.append('(').append(kind).append(')');
        } else if (strlen != null) {
            type.append("(len=").append(strlen).append(')');
        }
        return type.toString();
    }

    @Override
    public void freeze() {
        super.freeze();
        attributes = frozen(attributes);
    }
}
