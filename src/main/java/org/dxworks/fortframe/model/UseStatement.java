package org.dxworks.fortframe.model;

/**
 * One {@code use} statement. The only/rename clause is kept verbatim until correlation.
 */
public class UseStatement {
    public final Ref<Module> module;
    public final String clause;
    public final boolean intrinsic;

    public UseStatement(String moduleName, String clause, boolean intrinsic) {
        this.module = Ref.unresolved(moduleName);
        this.clause = clause == null ? "" : clause.trim();
        this.intrinsic = intrinsic;
    }

    public String getModuleName() {
        return module.getName();
    }
}
