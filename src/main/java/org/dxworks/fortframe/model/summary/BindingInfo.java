package org.dxworks.fortframe.model.summary;

import java.util.ArrayList;
import java.util.List;

public class BindingInfo {
    public String name;
    public String permission;
    public boolean generic;
    public Boolean deferred;
    public List<String> attributes = new ArrayList<>();
    public ReferenceInfo prototype;
    public List<ReferenceInfo> bindings = new ArrayList<>();
}
