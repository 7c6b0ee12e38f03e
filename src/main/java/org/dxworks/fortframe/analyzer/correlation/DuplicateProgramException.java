package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.FortframeException;

public class DuplicateProgramException extends FortframeException {

    public DuplicateProgramException(String name, String firstFile, String secondFile) {
        super("Program '" + name + "' is defined in both " + firstFile + " and " + secondFile);
    }
}
