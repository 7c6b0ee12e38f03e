package org.dxworks.fortframe.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class DerivedType extends Entity {
    public final Ref<DerivedType> extendsType;
    public List<String> attributes = new ArrayList<>();
    public List<String> parameterNames = new ArrayList<>();
    public List<Variable> parameters = new ArrayList<>();
    public boolean sequence;
    public List<Variable> variables = new ArrayList<>();
    public List<BoundProcedure> boundProcedures = new ArrayList<>();
    public List<FinalProcedure> finalProcedures = new ArrayList<>();

    /** Public components of the ancestors, not owned. */
    public List<Variable> inheritedVariables = new ArrayList<>();
    /** Specific bindings of the ancestors that this type does not override, not owned. */
    public List<BoundProcedure> inheritedBoundProcedures = new ArrayList<>();
    /** Copies of the ancestors' generic bindings, re-resolved against this type. */
    public List<BoundProcedure> inheritedGenerics = new ArrayList<>();

    public Ref<Entity> constructor;
    public boolean extensionCycle;
    /** Types that have a component of this type. */
    public List<DerivedType> componentOf = Collections.synchronizedList(new ArrayList<>());

    public DerivedType(String name, Entity parent, Permission permission, String extendsName) {
        super(name, parent, permission);
        this.extendsType = extendsName == null ? null : Ref.unresolved(extendsName);
    }

    @Override
    public EntityKind getKind() {
        return EntityKind.DERIVED_TYPE;
    }

    @Override
    public <R> R accept(EntityVisitor<R> visitor) {
        return visitor.visitDerivedType(this);
    }

    @Override
    public List<Entity> children() {
        return concat(parameters, variables, inheritedGenerics, boundProcedures, finalProcedures);
    }

    public List<Variable> allComponents() {
        List<Variable> all = new ArrayList<>(inheritedVariables);
        all.addAll(variables);
        return all;
    }

    public List<BoundProcedure> allBoundProcedures() {
        List<BoundProcedure> all = new ArrayList<>(inheritedBoundProcedures);
        all.addAll(inheritedGenerics);
        all.addAll(boundProcedures);
        return all;
    }

    /**
     * Resolved ancestors, nearest first. Stops at the first unresolved link or repeated type.
     */
    public List<DerivedType> ancestors() {
        List<DerivedType> chain = new ArrayList<>();
        Set<DerivedType> seen = new HashSet<>();
        seen.add(this);
        Ref<DerivedType> next = extendsType;
        while (next != null && next.isResolved() && seen.add(next.get())) {
            chain.add(next.get());
            next = next.get().extendsType;
        }
        return chain;
    }

    public void addComponentOf(DerivedType container) {
        synchronized (componentOf) {
            if (!componentOf.contains(container)) {
                componentOf.add(container);
            }
        }
    }

    @Override
    public void freeze() {
        super.freeze();
        attributes = frozen(attributes);
        parameterNames = frozen(parameterNames);
        parameters = frozen(parameters);
        variables = frozen(variables);
        boundProcedures = frozen(boundProcedures);
        finalProcedures = frozen(finalProcedures);
        inheritedVariables = frozen(inheritedVariables);
        inheritedBoundProcedures = frozen(inheritedBoundProcedures);
        inheritedGenerics = frozen(inheritedGenerics);
        componentOf = frozen(componentOf);
    }
}
