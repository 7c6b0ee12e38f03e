package org.dxworks.fortframe.model.summary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One module, submodule, program, block data unit or file-level procedure, with its declarations and resolved references.
 */
public class UnitSummary implements Summary {
    public String kind;
    public String name;
    public String file;
    public String url;
    public String permission;
    public String defaultAccess;
    public ReferenceInfo ancestorModule;
    public ReferenceInfo parentSubmodule;
    public Map<String, String> metadata = new LinkedHashMap<>();
    public String doc;
    public ProcedureInfo signature;
    public List<UseInfo> uses = new ArrayList<>();
    public List<VariableInfo> variables = new ArrayList<>();
    public List<TypeSummary> types = new ArrayList<>();
    public List<ProcedureInfo> procedures = new ArrayList<>();
    public List<InterfaceInfo> interfaces = new ArrayList<>();
    public List<InterfaceInfo> absInterfaces = new ArrayList<>();
    public List<ProcedureInfo> moduleProcedures = new ArrayList<>();
    public List<String> exports = new ArrayList<>();
    public List<String> usedBy = new ArrayList<>();
    public List<String> descendants = new ArrayList<>();
    public List<CommonBlockInfo> commonBlocks = new ArrayList<>();
    public List<NamelistInfo> namelists = new ArrayList<>();

    @Override
    public String getKind() {
        return kind;
    }
}
