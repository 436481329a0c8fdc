package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;

public class ReplaceFunctionBodyChange extends PlannedChange {
    public String name;
    public String body;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(name, "name", type);
        modifier.replaceFunctionBody(name, body);
    }
}
