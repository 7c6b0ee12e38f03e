package org.dxworks.fortframe.analyzer.reader;

/**
 * A source file, or a file it includes, could not be read.
 */
public class SourceReadException extends RuntimeException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
