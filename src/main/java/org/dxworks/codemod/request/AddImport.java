package org.dxworks.codemod.request;

import org.dxworks.codemod.imports.ImportSpec;

public class AddImport implements ModificationRequest {
    private final ImportSpec spec;

    public AddImport(ImportSpec spec) {
        if (spec == null) throw new IllegalArgumentException("Import spec is required");
        this.spec = spec;
    }

    public ImportSpec getSpec() {
        return spec;
    }

    @Override
    public RequestType getType() {
        return RequestType.ADD_IMPORT;
    }

    @Override
    public String describe() {
        return "add import from '" + spec.getSource() + "'";
    }
}
