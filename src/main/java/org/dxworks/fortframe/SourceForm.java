package org.dxworks.fortframe;

public enum SourceForm {
    FREE("free"),
    FIXED("fixed");

    private final String name;

    SourceForm(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
