package org.dxworks.fortframe.analyzer.reader;

import org.dxworks.fortframe.ConfigurationException;
import org.dxworks.fortframe.FortframeConfig;

/**
 * The four documentation comment marks. An empty alternate mark disables that kind of block.
 */
public final class DocMarks {

    private final String docmark;
    private final String predocmark;
    private final String docmarkAlt;
    private final String predocmarkAlt;

    public DocMarks(String docmark, String predocmark, String docmarkAlt, String predocmarkAlt) {
        this.docmark = nullToEmpty(docmark);
        this.predocmark = nullToEmpty(predocmark);
        this.docmarkAlt = nullToEmpty(docmarkAlt);
        this.predocmarkAlt = nullToEmpty(predocmarkAlt);
        if (this.docmark.isEmpty()) {
            throw new ConfigurationException("docmark must not be empty");
        }
        String[] names = {"docmark", "predocmark", "docmark_alt", "predocmark_alt"};
        String[] marks = {this.docmark, this.predocmark, this.docmarkAlt, this.predocmarkAlt};
        for (int i = 0; i < marks.length; i++) {
            for (int j = i + 1; j < marks.length; j++) {
                if (!marks[i].isEmpty() && marks[i].equals(marks[j])) {
                    throw new ConfigurationException(names[i] + " ('" + marks[i] + "') and "
                            + names[j] + " ('" + marks[j] + "') are the same");
                }
            }
        }
    }

    public static DocMarks of(FortframeConfig config) {
        return new DocMarks(config.getDocmark(), config.getPredocmark(), config.getDocmarkAlt(), config.getPredocmarkAlt());
    }

    /**
     * Prefix of the documentation pseudo-statements the reader emits, {@code !!} by default.
     */
    public String docPrefix() {
        return "!" + docmark;
    }

    public boolean isDocLine(String statement) {
        return statement.startsWith(docPrefix());
    }

    /**
     * Documentation text of a pseudo-statement, without its prefix.
     */
    public String docText(String statement) {
        return statement.substring(docPrefix().length());
    }

    public String getDocmark() {
        return docmark;
    }

    public String getPredocmark() {
        return predocmark;
    }

    public String getDocmarkAlt() {
        return docmarkAlt;
    }

    public String getPredocmarkAlt() {
        return predocmarkAlt;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
