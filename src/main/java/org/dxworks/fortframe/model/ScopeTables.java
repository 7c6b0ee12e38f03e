package org.dxworks.fortframe.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Name tables of one scope, keyed by lower-cased name. The first entry under a name wins, so the order of
 * merging decides between two symbols that share a name.
 */
public class ScopeTables {

    public final Map<String, Entity> procedures = new LinkedHashMap<>();
    public final Map<String, DerivedType> types = new LinkedHashMap<>();
    public final Map<String, Interface> absInterfaces = new LinkedHashMap<>();
    public final Map<String, Entity> variables = new LinkedHashMap<>();

    public void addProcedure(Entity procedure) {
        procedures.putIfAbsent(key(procedure.getName()), procedure);
    }

    public void addType(DerivedType type) {
        types.putIfAbsent(key(type.getName()), type);
    }

    public void addAbsInterface(Interface absInterface) {
        absInterfaces.putIfAbsent(key(absInterface.getName()), absInterface);
    }

    public void addVariable(Entity variable) {
        variables.putIfAbsent(key(variable.getName()), variable);
    }

    public void mergeFrom(ScopeTables other) {
        other.procedures.forEach(procedures::putIfAbsent);
        other.types.forEach(types::putIfAbsent);
        other.absInterfaces.forEach(absInterfaces::putIfAbsent);
        other.variables.forEach(variables::putIfAbsent);
    }

    public boolean isEmpty() {
        return procedures.isEmpty() && types.isEmpty() && absInterfaces.isEmpty() && variables.isEmpty();
    }

    public static String key(String name) {
        return name.replace(" ", "").toLowerCase(Locale.ROOT);
    }
}
