package org.dxworks.fortframe.model.summary;

import java.util.ArrayList;
import java.util.List;

public class CommonBlockInfo {
    public String name;
    public String url;
    public List<VariableInfo> variables = new ArrayList<>();
    public String doc;
}
