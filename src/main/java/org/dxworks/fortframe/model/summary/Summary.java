package org.dxworks.fortframe.model.summary;

/**
 * Marker interface for the records written to the JSON Lines report.
 */
public interface Summary {
    String getKind();
}
