package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Module extends CodeUnit {
    /** Accessibility given by a bare {@code public} or {@code private} statement. */
    public Permission defaultAccess;
    public List<ModuleProcedureImplementation> modProcedures = new ArrayList<>();

    /** Public and protected symbols, own and re-exported, filled in during correlation. */
    public final ScopeTables exports = new ScopeTables();

    public List<Submodule> descendants = Collections.synchronizedList(new ArrayList<>());
    public List<CodeUnit> usedBy = Collections.synchronizedList(new ArrayList<>());

    public Module(String name, Entity parent) {
        this(name, parent, Permission.PUBLIC);
    }

    protected Module(String name, Entity parent, Permission defaultAccess) {
        super(name, parent, Permission.PUBLIC);
        this.defaultAccess = defaultAccess;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.MODULE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitModule(this);
    }

    @Override
    public List<Entity> children() {
        List<Entity> children = super.children();
        children.addAll(modProcedures);
        return children;
    }

    public boolean isExternal() {
        return false;
    }

    /**
     * Whether a symbol of this module may be passed on to modules that use it.
     */
    public boolean shouldExport(String lowerName) {
        if (publicNames.contains(lowerName)) {
            return true;
        }
        return defaultAccess == Permission.PUBLIC && !privateNames.contains(lowerName);
    }

    public void addUser(CodeUnit user) {
        synchronized (usedBy) {
            if (!usedBy.contains(user)) {
                usedBy.add(user);
            }
        }
    }

    public void addDescendant(Submodule submodule) {
        synchronized (descendants) {
            if (!descendants.contains(submodule)) {
                descendants.add(submodule);
            }
        }
    }

    @Override
    public void freeze() {
        super.freeze();
        modProcedures = frozen(modProcedures);
        descendants = frozen(descendants);
        usedBy = frozen(usedBy);
    }
}
