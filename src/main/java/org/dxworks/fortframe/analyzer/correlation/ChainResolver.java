package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.Diagnostics;
import org.dxworks.fortframe.model.BoundProcedure;
import org.dxworks.fortframe.model.CallSite;
import org.dxworks.fortframe.model.CodeUnit;
import org.dxworks.fortframe.model.DerivedType;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.ScopeTables;
import org.dxworks.fortframe.model.Variable;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the target of a {@code call}. A plain name is looked up among the procedures visible in the calling
 * scope; a chain such as {@code grid%solver%run} is followed through variable and component types to a
 * type-bound procedure or procedure pointer component.
 */
final class ChainResolver {

    private final Diagnostics diagnostics;

    ChainResolver(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    void resolve(CallSite call, CodeUnit caller) {
        if (call.target.isResolved()) {
            return;
        }
        Entity target = call.chain.size() == 1
                ? resolveName(call.getName(), caller.visible)
                : resolveChain(call.chain, caller.visible);
        if (target == null) {
            diagnostics.warn("Could not resolve call to '" + String.join("%", call.chain) + "' in "
                    + caller.getKind().getName() + " '" + caller.getName() + "'");
            return;
        }
        call.target.resolve(target);
    }

    private static Entity resolveName(String name, ScopeTables visible) {
        Entity procedure = visible.procedures.get(ScopeTables.key(name));
        if (procedure != null) {
            return procedure;
        }
        Entity variable = visible.variables.get(ScopeTables.key(name));
        if (variable instanceof Variable pointer && pointer.isProcedurePointer()) {
            return pointer;
        }
        return null;
    }

    private static Entity resolveChain(List<String> chain, ScopeTables visible) {
        DerivedType type = typeOf(visible.variables.get(ScopeTables.key(chain.get(0))));
        for (int i = 1; i < chain.size() - 1 && type != null; i++) {
            type = typeOf(findComponent(type, chain.get(i)));
        }
        if (type == null) {
            return null;
        }
        String last = chain.get(chain.size() - 1);
        List<BoundProcedure> candidates = new ArrayList<>(type.boundProcedures);
        candidates.addAll(type.inheritedGenerics);
        candidates.addAll(type.inheritedBoundProcedures);
        for (BoundProcedure binding : candidates) {
            if (binding.getName().equalsIgnoreCase(last)) {
                return binding;
            }
        }
        Variable component = findComponent(type, last);
        return component != null && component.isProcedurePointer() ? component : null;
    }

    private static Variable findComponent(DerivedType type, String name) {
        for (Variable component : type.allComponents()) {
            if (component.getName().equalsIgnoreCase(name)) {
                return component;
            }
        }
        return null;
    }

    private static DerivedType typeOf(Entity entity) {
        if (entity instanceof Variable variable && variable.prototype != null
                && variable.prototype.target().orElse(null) instanceof DerivedType type) {
            return type;
        }
        return null;
    }
}
