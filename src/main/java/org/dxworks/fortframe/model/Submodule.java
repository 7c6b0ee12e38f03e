package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code submodule (ancestor[:parent]) name}. Its scope extends the parent submodule, or the ancestor module
 * when there is no parent.
 */
public class Submodule extends Module {
    public final Ref<Module> ancestorModule;
    public final Ref<Submodule> parentSubmodule;

    public Submodule(String name, Entity parent, String ancestorModule, String parentSubmodule) {
        super(name, parent, Permission.PUBLIC);
        this.permission = Permission.PRIVATE;
        this.ancestorModule = Ref.unresolved(ancestorModule);
        this.parentSubmodule = parentSubmodule == null ? null : Ref.unresolved(parentSubmodule);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.SUBMODULE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitSubmodule(this);
    }

    /**
     * Resolved parent submodules, nearest first, ending before the ancestor module.
     */
    public List<Submodule> ancestry() {
        List<Submodule> chain = new ArrayList<>();
        Set<Submodule> seen = new HashSet<>();
        seen.add(this);
        Ref<Submodule> next = parentSubmodule;
        while (next != null && next.isResolved() && seen.add(next.get())) {
            chain.add(next.get());
            next = next.get().parentSubmodule;
        }
        return chain;
    }
}
