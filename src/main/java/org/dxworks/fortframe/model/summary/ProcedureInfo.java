package org.dxworks.fortframe.model.summary;

import java.util.ArrayList;
import java.util.List;

public class ProcedureInfo {
    public String kind;
    public String name;
    public String permission;
    public String url;
    public List<String> attributes = new ArrayList<>();
    public String bindC;
    public List<VariableInfo> arguments = new ArrayList<>();
    public List<ProcedureInfo> procedureArguments = new ArrayList<>();
    public VariableInfo result;
    public List<CallInfo> calls = new ArrayList<>();
    public ReferenceInfo implementsInterface;
    public String doc;
}
