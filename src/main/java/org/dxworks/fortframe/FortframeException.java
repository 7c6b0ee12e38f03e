package org.dxworks.fortframe;

/**
 * Root of the errors that abort a whole run.
 */
public class FortframeException extends RuntimeException {

    public FortframeException(String message) {
        super(message);
    }

    public FortframeException(String message, Throwable cause) {
        super(message, cause);
    }
}
