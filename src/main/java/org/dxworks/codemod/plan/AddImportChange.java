package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.imports.ImportSpec;

import java.util.ArrayList;
import java.util.List;

public class AddImportChange extends PlannedChange {
    public String source;
    public String defaultImport;
    public List<String> namedImports = new ArrayList<>();
    public String namespaceImport;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(source, "source", type);
        modifier.addImport(new ImportSpec(source, defaultImport, namedImports, namespaceImport));
    }
}
