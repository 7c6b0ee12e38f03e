package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gives every entity of a project a stable integer handle, in registration order.
 */
public class EntityArena {

    private final List<Entity> entities = new ArrayList<>();

    public synchronized int register(Entity entity) {
        if (entity.getHandle() >= 0) {
            return entity.getHandle();
        }
        entity.setHandle(entities.size());
        entities.add(entity);
        return entity.getHandle();
    }

    /**
     * Registers {@code root} and everything it owns, depth first.
     */
    public void registerTree(Entity root) {
        register(root);
        for (Entity child : root.children()) {
            registerTree(child);
        }
    }

    public synchronized Entity get(int handle) {
        return entities.get(handle);
    }

    public synchronized int size() {
        return entities.size();
    }

    public synchronized List<Entity> entities() {
        return Collections.unmodifiableList(new ArrayList<>(entities));
    }
}
