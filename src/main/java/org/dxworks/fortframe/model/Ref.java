package org.dxworks.fortframe.model;

import java.util.Locale;
import java.util.Optional;

/**
 * A reference to another entity by name. It starts out unresolved and is resolved at most once, during
 * correlation. A reference that stays unresolved keeps the name as written.
 */
public final class Ref<T extends Entity> {

    private final String name;
    private T target;

    private Ref(String name, T target) {
        this.name = name;
        this.target = target;
    }

    public static <T extends Entity> Ref<T> unresolved(String name) {
        return new Ref<>(name, null);
    }

    public static <T extends Entity> Ref<T> resolved(T target) {
        return new Ref<>(target.getName(), target);
    }

    public String getName() {
        return name;
    }

    public String getLowerName() {
        return name.toLowerCase(Locale.ROOT);
    }

    public boolean isResolved() {
        return target != null;
    }

    public Optional<T> target() {
        return Optional.ofNullable(target);
    }

    public T get() {
        if (target == null) {
            throw new IllegalStateException("Reference '" + name + "' is unresolved");
        }
        return target;
    }

    public void resolve(T entity) {
        if (target != null && target != entity) {
            throw new IllegalStateException("Reference '" + name + "' is already resolved to " + target);
        }
        this.target = entity;
    }

    @Override
    public String toString() {
        return target == null ? "Unresolved(" + name + ")" : "Resolved(" + target.getKind().getName() + " " + name + ")";
    }
}
