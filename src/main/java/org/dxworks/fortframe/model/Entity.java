package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base of every node in the parsed tree. The parent link is a back pointer; ownership runs through the child
 * collections of each subclass.
 */
public abstract class Entity {

    protected final String name;
    public Permission permission;
    public Entity parent;
    public List<String> docLines = new ArrayList<>();
    public Map<String, String> metadata = new LinkedHashMap<>();
    public int lineNumber;

    private int handle = -1;
    private String identifier;
    private String url;

    protected Entity(String name, Entity parent, Permission permission) {
        this.name = name;
        this.parent = parent;
        this.permission = permission;
    }

    public abstract EntityKind getKind();

    public abstract <R> R accept(EntityVisitor<R> visitor);

    /**
     * Owned children, in declaration order.
     */
    public List<Entity> children() {
        return Collections.emptyList();
    }

    public String getName() {
        return name;
    }

    public String getLowerName() {
        return name.toLowerCase(Locale.ROOT);
    }

    public boolean hasDocumentation() {
        for (String line : docLines) {
            if (!line.isBlank()) {
                return true;
            }
        }
        return false;
    }

    public String getDocumentation() {
        return String.join("\n", docLines).strip();
    }

    public SourceFile getSourceFile() {
        Entity current = this;
        while (current != null && !(current instanceof SourceFile)) {
            current = current.parent;
        }
        return (SourceFile) current;
    }

    public int getHandle() {
        return handle;
    }

    void setHandle(int handle) {
        this.handle = handle;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getUrl() {
        return url;
    }

    public void assignIdentity(String identifier, String url) {
        this.identifier = identifier;
        this.url = url;
    }

    /**
     * Replaces the mutable collections by read-only copies once the tree is final.
     */
    public void freeze() {
        docLines = List.copyOf(docLines);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    protected static <T> List<T> frozen(List<T> list) {
        synchronized (list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
    }

    @SafeVarargs
    protected static List<Entity> concat(List<? extends Entity>... lists) {
        List<Entity> all = new ArrayList<>();
        for (List<? extends Entity> list : lists) {
            all.addAll(list);
        }
        return all;
    }

    @Override
    public String toString() {
        return getKind().getName() + " " + name;
    }
}
