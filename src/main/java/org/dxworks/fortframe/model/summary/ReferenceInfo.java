package org.dxworks.fortframe.model.summary;

public class ReferenceInfo {
    public String name;
    public String kind;
    public String url;
    public boolean resolved;
}
