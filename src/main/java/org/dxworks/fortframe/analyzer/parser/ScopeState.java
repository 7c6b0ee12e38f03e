package org.dxworks.fortframe.analyzer.parser;

import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.Permission;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Parser state of one open scope. The ambient permission lives here rather than on the entity.
 */
final class ScopeState {
    final Entity scope;
    Permission childPermission;
    boolean inContains;
    int blockLevel;
    final AttributeTable attributes = new AttributeTable();
    final Deque<Map<String, List<String>>> associations = new ArrayDeque<>();

    ScopeState(Entity scope, Permission childPermission) {
        this.scope = scope;
        this.childPermission = childPermission;
    }
}
