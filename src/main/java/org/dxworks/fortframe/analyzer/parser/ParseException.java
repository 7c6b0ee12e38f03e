package org.dxworks.fortframe.analyzer.parser;

/**
 * A statement the parser cannot place. Parsing of the file stops; other files are unaffected.
 */
public class ParseException extends RuntimeException {

    private final String file;
    private final int line;

    public ParseException(String file, int line, String message) {
        super(file + ":" + line + ": " + message);
        this.file = file;
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }
}
