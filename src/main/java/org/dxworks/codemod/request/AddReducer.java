package org.dxworks.codemod.request;

public class AddReducer implements ModificationRequest {
    private final ReducerSpec spec;

    public AddReducer(ReducerSpec spec) {
        if (spec == null) throw new IllegalArgumentException("Reducer spec is required");
        this.spec = spec;
    }

    public ReducerSpec getSpec() {
        return spec;
    }

    @Override
    public RequestType getType() {
        return RequestType.ADD_REDUCER;
    }

    @Override
    public String describe() {
        return "add reducer '" + spec.getName() + "'";
    }
}
