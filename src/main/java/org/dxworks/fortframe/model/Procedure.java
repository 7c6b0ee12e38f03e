package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Function or subroutine. {@link #argNames} holds the dummy argument names as written; {@link #args} holds the
 * matching variables or procedure arguments once the scope is closed.
 */
public abstract class Procedure extends CodeUnit {
    public List<String> attributes = new ArrayList<>();
    public List<String> argNames = new ArrayList<>();
    public List<Entity> args = new ArrayList<>();
    public String bindC;
    /** Declared with the {@code module} prefix, so its interface lives in an ancestor module. */
    public boolean separateModuleProcedure;
    /** For separate module procedures, the interface body that declares them. */
    public Ref<Interface> separateInterface;

    protected Procedure(String name, Entity parent, Permission permission) {
        super(name, parent, permission);
    }

    @Override
    public List<Entity> children() {
        List<Entity> children = new ArrayList<>(args);
        children.addAll(super.children());
        return children;
    }

    @Override
    public void freeze() {
        super.freeze();
        attributes = frozen(attributes);
        argNames = frozen(argNames);
        args = frozen(args);
    }
}
