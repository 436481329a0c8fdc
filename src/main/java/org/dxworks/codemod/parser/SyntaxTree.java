package org.dxworks.codemod.parser;

import org.dxworks.codemod.Dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only parse result for one session: the root node plus the syntax problems found in it.
 */
public final class SyntaxTree {
    private final Dialect dialect;
    private final SourceText source;
    private final SyntaxNode root;
    private final List<SyntaxDiagnostic> diagnostics;

    SyntaxTree(Dialect dialect, SourceText source, SyntaxNode root, List<SyntaxDiagnostic> diagnostics) {
        this.dialect = dialect;
        this.source = source;
        this.root = root;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
    }

    public Dialect getDialect() {
        return dialect;
    }

    public SourceText getSource() {
        return source;
    }

    public String getSourceCode() {
        return source.getText();
    }

    public SyntaxNode getRootNode() {
        return root;
    }

    public List<SyntaxDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * True when {@code node} was produced by this tree, so its range is meaningful here.
     */
    public boolean owns(SyntaxNode node) {
        return node != null && node.getSource() == source && root.contains(node);
    }
}
