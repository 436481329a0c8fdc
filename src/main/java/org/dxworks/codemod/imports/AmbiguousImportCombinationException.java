package org.dxworks.codemod.imports;

/**
 * A single import may not bind both a default and a namespace specifier for the same source
 * ({@code import React, * as ReactNS from 'react'} is not produced by this engine).
 */
public class AmbiguousImportCombinationException extends IllegalArgumentException {
    private final String source;

    public AmbiguousImportCombinationException(String source, String defaultImport, String namespaceImport) {
        super("Cannot import both default '" + defaultImport + "' and namespace '" + namespaceImport
                + "' from '" + source + "' in one statement");
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
