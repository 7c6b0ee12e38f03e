package org.dxworks.fortframe.model.summary;

import java.util.ArrayList;
import java.util.List;

public class NamelistInfo {
    public String name;
    public String permission;
    public String url;
    public List<ReferenceInfo> variables = new ArrayList<>();
    public String doc;
}
