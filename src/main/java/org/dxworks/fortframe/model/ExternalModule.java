package org.dxworks.fortframe.model;

/**
 * A module that is not part of the project, such as {@code iso_fortran_env}. Only its documentation link is
 * known.
 */
public class ExternalModule extends Module {
    public final String url;

    public ExternalModule(String name, String url) {
        super(name, null);
        this.url = url;
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.EXTERNAL_MODULE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitExternalModule(this);
    }

    @Override
    public boolean isExternal() {
        return true;
    }
}
