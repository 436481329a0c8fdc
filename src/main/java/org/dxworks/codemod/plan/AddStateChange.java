package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.StateVariableSpec;

public class AddStateChange extends PlannedChange {
    public String name;
    public String setter;
    public String initialValue;
    public String component;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(name, "name", type);
        modifier.addStateVariable(new StateVariableSpec(name, setter, initialValue, component));
    }
}
