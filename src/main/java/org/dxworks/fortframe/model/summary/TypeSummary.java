package org.dxworks.fortframe.model.summary;

import java.util.ArrayList;
import java.util.List;

public class TypeSummary {
    public String name;
    public String permission;
    public String url;
    public List<String> attributes = new ArrayList<>();
    public ReferenceInfo extendsType;
    public List<String> ancestors = new ArrayList<>();
    public Boolean extensionCycle;
    public List<String> parameters = new ArrayList<>();
    public List<VariableInfo> components = new ArrayList<>();
    public List<String> inheritedComponents = new ArrayList<>();
    public List<BindingInfo> boundProcedures = new ArrayList<>();
    public List<String> inheritedBindings = new ArrayList<>();
    public List<ReferenceInfo> finalProcedures = new ArrayList<>();
    public ReferenceInfo constructor;
    public List<String> componentOf = new ArrayList<>();
    public String doc;
}
