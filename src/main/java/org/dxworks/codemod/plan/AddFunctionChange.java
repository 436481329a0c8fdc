package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.FunctionSpec;

import java.util.ArrayList;
import java.util.List;

public class AddFunctionChange extends PlannedChange {
    public String name;
    public List<String> params = new ArrayList<>();
    public String body;
    public boolean arrow = true;
    public boolean async;
    public String component;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(name, "name", type);
        modifier.addFunction(new FunctionSpec(name, params, body, arrow, async, component));
    }
}
