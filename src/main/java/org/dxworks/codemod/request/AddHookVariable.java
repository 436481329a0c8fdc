package org.dxworks.codemod.request;

public class AddHookVariable implements ModificationRequest {
    private final HookVariableSpec spec;

    public AddHookVariable(HookVariableSpec spec) {
        if (spec == null) throw new IllegalArgumentException("Hook spec is required");
        this.spec = spec;
    }

    public HookVariableSpec getSpec() {
        return spec;
    }

    @Override
    public RequestType getType() {
        return RequestType.ADD_HOOK_VARIABLE;
    }

    @Override
    public String describe() {
        return "add " + spec.getKind().getHookName() + " '" + spec.getName() + "'";
    }
}
