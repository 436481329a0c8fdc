package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.UseEffectSpec;

import java.util.List;

public class AddEffectChange extends PlannedChange {
    public String body;
    /** Absent means no dependency array at all. */
    public List<String> dependencies;
    public String cleanup;
    public String component;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(body, "body", type);
        modifier.addUseEffect(new UseEffectSpec(body, dependencies, cleanup, component));
    }
}
