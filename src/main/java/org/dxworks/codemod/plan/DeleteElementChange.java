package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;

public class DeleteElementChange extends ElementChange {

    @Override
    public void applyTo(ComponentModifier modifier) {
        modifier.deleteElement(locator());
    }
}
