package org.dxworks.fortframe.model.summary;

import java.util.ArrayList;
import java.util.List;

public class InterfaceInfo {
    public String name;
    public String permission;
    public String url;
    public boolean generic;
    public boolean isAbstract;
    public List<ProcedureInfo> procedures = new ArrayList<>();
    public List<ReferenceInfo> moduleProcedures = new ArrayList<>();
    public ReferenceInfo implementation;
    public String doc;
}
