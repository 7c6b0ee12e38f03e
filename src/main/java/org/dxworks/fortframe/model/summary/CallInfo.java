package org.dxworks.fortframe.model.summary;

public class CallInfo {
    public String call;
    public ReferenceInfo target;
}
