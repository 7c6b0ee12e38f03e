package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.model.BlockData;
import org.dxworks.fortframe.model.CodeUnit;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.ExternalModule;
import org.dxworks.fortframe.model.Interface;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.ModuleProcedureImplementation;
import org.dxworks.fortframe.model.Procedure;
import org.dxworks.fortframe.model.Program;
import org.dxworks.fortframe.model.SourceFile;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Gives every entity an identifier usable in a path or URL fragment. Entities with a page of their own get
 * {@code <namespace>/<ident>.html}; everything else is an anchor {@code <page>#<kind>-<ident>} on the page of its
 * nearest ancestor that has one. A name seen before in the same namespace gets a {@code ~N} suffix.
 */
public final class IdentifierAssigner {

    private final Map<String, Integer> seen = new HashMap<>();

    public void assign(List<SourceFile> files) {
        for (SourceFile file : files) {
            assignPage(file, "sourcefile");
            for (Entity child : file.children()) {
                assignTopLevel(child);
            }
        }
    }

    public void assignExternal(ExternalModule module) {
        module.assignIdentity(ident(module.getName(), "external"), module.url);
    }

    /**
     * The lower-cased name with characters that can not appear in a file name spelled out.
     */
    public static String normalize(String name) {
        String ident = name.toLowerCase(Locale.ROOT)
                .replace("<", "lt")
                .replace(">", "gt")
                .replace("/", "SLASH")
                .replace("*", "ASTERISK");
        return ident.isEmpty() ? "__unnamed__" : ident;
    }

    private void assignTopLevel(Entity entity) {
        String namespace = pageNamespace(entity);
        if (namespace == null) {
            assignMember(entity, entity.parent.getUrl());
            return;
        }
        assignPage(entity, namespace);
        for (Entity child : entity.children()) {
            assignTopLevel(child);
        }
    }

    private void assignPage(Entity entity, String namespace) {
        String ident = ident(entity.getName(), namespace);
        entity.assignIdentity(ident, namespace + "/" + ident + ".html");
    }

    private void assignMember(Entity entity, String page) {
        String kind = entity.getKind().getName();
        String ident = ident(entity.getName(), page + "#" + kind);
        entity.assignIdentity(ident, page + "#" + kind + "-" + ident);
        for (Entity child : entity.children()) {
            assignMember(child, page);
        }
    }

    private String ident(String name, String namespace) {
        String ident = normalize(name);
        String key = namespace + "/" + ident;
        int count = seen.merge(key, 1, Integer::sum);
        return count == 1 ? ident : ident + "~" + (count - 1);
    }

    /**
     * The namespace of entities that get a page, or null for those documented on their parent's page.
     */
    private static String pageNamespace(Entity entity) {
        Entity parent = entity.parent;
        boolean topLevelParent = parent instanceof SourceFile || parent instanceof Module;
        if (entity instanceof Module) {
            return "module";
        }
        if (entity instanceof Program) {
            return "program";
        }
        if (entity instanceof BlockData) {
            return "blockdata";
        }
        if (entity instanceof DerivedType && parent instanceof CodeUnit && !(parent instanceof Procedure)) {
            return "type";
        }
        if ((entity instanceof Procedure || entity instanceof ModuleProcedureImplementation) && topLevelParent) {
            return "proc";
        }
        if (entity instanceof Interface && parent instanceof Module) {
            return "interface";
        }
        return null;
    }
}
