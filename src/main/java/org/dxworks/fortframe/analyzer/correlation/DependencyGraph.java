package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.model.CodeUnit;
import org.dxworks.fortframe.model.Entity;
import org.dxworks.fortframe.model.Module;
import org.dxworks.fortframe.model.Submodule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders modules and submodules so that every unit comes after the modules it uses and the submodule or module
 * it extends. Units of one rank are sorted by name, so the order does not depend on the order of the input files.
 */
final class DependencyGraph {

    private final List<Module> nodes;
    private final Map<Module, Set<Module>> dependencies = new IdentityHashMap<>();

    DependencyGraph(List<Module> nodes) {
        this.nodes = List.copyOf(nodes);
        Set<Module> known = Collections.newSetFromMap(new IdentityHashMap<>());
        known.addAll(nodes);
        for (Module node : nodes) {
            Set<Module> deps = new LinkedHashSet<>();
            if (node instanceof Submodule submodule) {
                if (submodule.parentSubmodule != null && submodule.parentSubmodule.isResolved()) {
                    deps.add(submodule.parentSubmodule.get());
                } else if (submodule.ancestorModule.isResolved()) {
                    deps.add(submodule.ancestorModule.get());
                }
            }
            collectUses(node, deps);
            deps.removeIf(dep -> dep == node || !known.contains(dep));
            dependencies.put(node, deps);
        }
    }

    /**
     * @throws DependencyCycleException when some units can not be ordered
     */
    List<Module> order() {
        Map<Module, Integer> index = new IdentityHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }
        Comparator<Module> byName = Comparator.comparing(Module::getLowerName)
                .thenComparing(index::get);

        List<Module> ordered = new ArrayList<>();
        Set<Module> placed = Collections.newSetFromMap(new IdentityHashMap<>());
        while (ordered.size() < nodes.size()) {
            List<Module> rank = new ArrayList<>();
            for (Module node : nodes) {
                if (!placed.contains(node) && placed.containsAll(dependencies.get(node))) {
                    rank.add(node);
                }
            }
            if (rank.isEmpty()) {
                throw new DependencyCycleException(findCycle(placed));
            }
            rank.sort(byName);
            ordered.addAll(rank);
            placed.addAll(rank);
        }
        return ordered;
    }

    private List<String> findCycle(Set<Module> placed) {
        for (Module start : nodes) {
            if (placed.contains(start)) {
                continue;
            }
            List<Module> path = new ArrayList<>();
            Map<Module, Integer> onPath = new HashMap<>();
            Module current = start;
            while (current != null && !onPath.containsKey(current)) {
                onPath.put(current, path.size());
                path.add(current);
                Module next = null;
                for (Module dep : dependencies.get(current)) {
                    if (!placed.contains(dep)) {
                        next = dep;
                        break;
                    }
                }
                current = next;
            }
            if (current != null) {
                List<String> cycle = new ArrayList<>();
                for (Module member : path.subList(onPath.get(current), path.size())) {
                    cycle.add(member.getName());
                }
                cycle.add(current.getName());
                return cycle;
            }
        }
        List<String> remaining = new ArrayList<>();
        for (Module node : nodes) {
            if (!placed.contains(node)) {
                remaining.add(node.getName());
            }
        }
        return remaining;
    }

    private static void collectUses(Entity entity, Set<Module> deps) {
        if (entity instanceof CodeUnit unit) {
            for (Module used : unit.usedModules()) {
                if (!used.isExternal()) {
                    deps.add(used);
                }
            }
        }
        for (Entity child : entity.children()) {
            collectUses(child, deps);
        }
    }
}
