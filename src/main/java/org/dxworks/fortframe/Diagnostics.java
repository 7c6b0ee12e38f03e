package org.dxworks.fortframe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Console reporting shared by every stage of a run. Warnings are kept so callers can inspect them after the run.
 */
public class Diagnostics {

    private final boolean warnEnabled;
    private final List<String> warnings = Collections.synchronizedList(new ArrayList<>());
    private final List<String> errors = Collections.synchronizedList(new ArrayList<>());

    public Diagnostics(boolean warnEnabled) {
        this.warnEnabled = warnEnabled;
    }

    public static Diagnostics of(FortframeConfig config) {
        return new Diagnostics(config.isWarn());
    }

    public void warn(String message) {
        if (!warnEnabled) {
            return;
        }
        warnings.add(message);
        synchronized (System.err) {
            System.err.println("Warning: " + message);
        }
    }

    public void error(String message) {
        errors.add(message);
        synchronized (System.err) {
            System.err.println("Error: " + message);
        }
    }

    public void info(String message) {
        synchronized (System.out) {
            System.out.println(message);
        }
    }

    public List<String> getWarnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    public List<String> getErrors() {
        synchronized (errors) {
            return List.copyOf(errors);
        }
    }
}
