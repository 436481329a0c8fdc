package org.dxworks.codemod;

import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTypescript;

import java.util.Optional;

public enum Dialect {
    JAVASCRIPT("javascript", ".js", ".jsx", ".mjs"),
    TYPESCRIPT("typescript", ".ts", ".tsx");

    private final String name;
    private final String[] extensions;

    Dialect(String name, String... extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public boolean matchesFileName(String fileName) {
        for (String extension : extensions) {
            if (fileName.endsWith(extension)) return true;
        }
        return false;
    }

    public TSLanguage newTreeSitterLanguage() {
        if (this == TYPESCRIPT) {
            return new TreeSitterTypescript();
        }
        return new TreeSitterJavascript();
    }

    public static Optional<Dialect> fromName(String name) {
        if (name == null) return Optional.empty();
        for (Dialect dialect : values()) {
            if (dialect.name.equalsIgnoreCase(name.trim())) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }
}
