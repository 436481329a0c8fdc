package org.dxworks.codemod.plan;

import org.dxworks.codemod.imports.ImportSpec;

import java.util.ArrayList;
import java.util.List;

public class ImportDescriptor {
    public String source;
    public String defaultImport;
    public List<String> namedImports = new ArrayList<>();
    public String namespaceImport;

    public ImportSpec toSpec() {
        return new ImportSpec(source, defaultImport, namedImports, namespaceImport);
    }
}
