package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.ConditionalRenderSpec;

public class ConditionalRenderChange extends PlannedChange {
    public String condition;
    public String fallback;
    public ConditionalRenderSpec.Style style = ConditionalRenderSpec.Style.TERNARY;
    public String component;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(condition, "condition", type);
        modifier.addConditionalRender(new ConditionalRenderSpec(condition, fallback, style, component));
    }
}
