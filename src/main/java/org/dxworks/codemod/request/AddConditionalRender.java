package org.dxworks.codemod.request;

public class AddConditionalRender implements ModificationRequest {
    private final ConditionalRenderSpec spec;

    public AddConditionalRender(ConditionalRenderSpec spec) {
        if (spec == null) throw new IllegalArgumentException("Conditional render spec is required");
        this.spec = spec;
    }

    public ConditionalRenderSpec getSpec() {
        return spec;
    }

    @Override
    public RequestType getType() {
        return RequestType.ADD_CONDITIONAL_RENDER;
    }

    @Override
    public String describe() {
        return "render conditionally on '" + spec.getCondition() + "'";
    }
}
