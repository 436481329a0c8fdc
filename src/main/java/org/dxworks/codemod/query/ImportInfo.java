package org.dxworks.codemod.query;

import org.dxworks.codemod.parser.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * What one existing {@code import_statement} brings in.
 */
public class ImportInfo {
    public SyntaxNode node;
    public SyntaxNode clause;
    public SyntaxNode namedImports;
    public String source;
    public char quote = '\'';
    public String defaultImport;
    public String namespaceImport;
    /** Specifier texts as written, e.g. {@code "useState"} or {@code "Foo as Bar"}. */
    public List<String> namedSpecifiers = new ArrayList<>();
    /** Imported (not local) names, parallel to {@link #namedSpecifiers}. */
    public List<String> importedNames = new ArrayList<>();
    public boolean typeOnly;

    public boolean isSideEffectOnly() {
        return clause == null;
    }

    public boolean isNamespaceOnly() {
        return namespaceImport != null && defaultImport == null && namedImports == null;
    }
}
