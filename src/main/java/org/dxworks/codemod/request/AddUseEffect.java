package org.dxworks.codemod.request;

public class AddUseEffect implements ModificationRequest {
    private final UseEffectSpec spec;

    public AddUseEffect(UseEffectSpec spec) {
        if (spec == null) throw new IllegalArgumentException("Effect spec is required");
        this.spec = spec;
    }

    public UseEffectSpec getSpec() {
        return spec;
    }

    @Override
    public RequestType getType() {
        return RequestType.ADD_USE_EFFECT;
    }

    @Override
    public String describe() {
        return "add effect";
    }
}
