package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A type-bound procedure ({@code procedure :: name => impl}) or generic binding ({@code generic :: name => a, b}).
 * Specific bindings resolve to procedures; generic bindings resolve to other bound procedures of the same type.
 */
public class BoundProcedure extends Entity {
    public final boolean generic;
    public List<String> attributes = new ArrayList<>();
    public boolean deferred;
    public Ref<Entity> prototype;
    public List<Ref<Entity>> bindings = new ArrayList<>();

    public BoundProcedure(String name, Entity parent, Permission permission, boolean generic) {
        super(name, parent, permission);
        this.generic = generic;
    }

    /**
     * A copy owned by {@code heir}, with every binding back to its unresolved name.
     */
    public BoundProcedure copyFor(DerivedType heir) {
        BoundProcedure copy = new BoundProcedure(name, heir, permission, generic);
        copy.attributes.addAll(attributes);
        copy.deferred = deferred;
        copy.docLines.addAll(docLines);
        copy.lineNumber = lineNumber;
        for (Ref<Entity> binding : bindings) {
            copy.bindings.add(Ref.unresolved(binding.getName()));
        }
        return copy;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.BOUND_PROCEDURE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitBoundProcedure(this);
    }

    @Override
    public void freeze() {
        super.freeze();
        attributes = frozen(attributes);
        bindings = frozen(bindings);
    }
}
