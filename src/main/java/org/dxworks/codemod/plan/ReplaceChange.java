package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;

public class ReplaceChange extends PlannedChange {
    public String searchFor;
    public String replaceWith;

    @Override
    public void applyTo(ComponentModifier modifier) {
        modifier.replaceText(searchFor, replaceWith);
    }
}
