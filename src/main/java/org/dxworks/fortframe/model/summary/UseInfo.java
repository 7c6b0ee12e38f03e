package org.dxworks.fortframe.model.summary;

public class UseInfo {
    public ReferenceInfo module;
    public String clause;
    public boolean intrinsic;
}
