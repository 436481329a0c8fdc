package org.dxworks.codemod.request;

public class AddStateVariable implements ModificationRequest {
    private final StateVariableSpec spec;

    public AddStateVariable(StateVariableSpec spec) {
        if (spec == null) throw new IllegalArgumentException("State variable spec is required");
        this.spec = spec;
    }

    public StateVariableSpec getSpec() {
        return spec;
    }

    @Override
    public RequestType getType() {
        return RequestType.ADD_STATE_VARIABLE;
    }

    @Override
    public String describe() {
        return "add state '" + spec.getName() + "'";
    }
}
