package org.dxworks.codemod.request;

public class AddFunction implements ModificationRequest {
    private final FunctionSpec spec;

    public AddFunction(FunctionSpec spec) {
        if (spec == null) throw new IllegalArgumentException("Function spec is required");
        this.spec = spec;
    }

    public FunctionSpec getSpec() {
        return spec;
    }

    @Override
    public RequestType getType() {
        return RequestType.ADD_FUNCTION;
    }

    @Override
    public String describe() {
        return "add function '" + spec.getName() + "'";
    }
}
