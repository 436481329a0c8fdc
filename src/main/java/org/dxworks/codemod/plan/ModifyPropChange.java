package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.PropSpec;

public class ModifyPropChange extends ElementChange {
    public String name;
    public String value;
    public PropSpec.Action action = PropSpec.Action.UPDATE;

    @Override
    public void applyTo(ComponentModifier modifier) {
        modifier.modifyProp(target(), new PropSpec(name, value, action));
    }
}
