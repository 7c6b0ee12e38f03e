package org.dxworks.fortframe.model.summary;

import java.util.ArrayList;
import java.util.List;

public class VariableInfo {
    public String name;
    public String type;
    public String permission;
    public List<String> attributes = new ArrayList<>();
    public String intent;
    public String dimension;
    public String initial;
    public Boolean optional;
    public Boolean parameter;
    public Boolean implicitlyTyped;
    public ReferenceInfo prototype;
    public String doc;
}
