package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.FortframeException;

import java.util.List;

/**
 * The modules and submodules of a project use each other in a cycle, so no correlation order exists.
 */
public class DependencyCycleException extends FortframeException {

    private final List<String> cycle;

    public DependencyCycleException(List<String> cycle) {
        super("Module dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> getCycle() {
        return cycle;
    }
}
