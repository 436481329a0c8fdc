package org.dxworks.codemod.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of one tree-sitter node. Ranges are UTF-8 byte offsets into the
 * {@link SourceText} the tree was parsed from; children keep their field names so nodes can be
 * addressed the way the grammar names them ("name", "value", "body", ...).
 */
public final class SyntaxNode {
    private final SourceText source;
    private final String type;
    private final int startIndex;
    private final int endIndex;
    private final int startRow;
    private final int startColumn;
    private final boolean named;
    private final boolean missing;
    private final SyntaxNode parent;
    private final List<SyntaxNode> children = new ArrayList<>();
    private final List<String> fieldNames = new ArrayList<>();

    SyntaxNode(SourceText source, String type, int startIndex, int endIndex, int startRow, int startColumn,
               boolean named, boolean missing, SyntaxNode parent) {
        this.source = source;
        this.type = type;
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.startRow = startRow;
        this.startColumn = startColumn;
        this.named = named;
        this.missing = missing;
        this.parent = parent;
    }

    void addChild(String fieldName, SyntaxNode child) {
        fieldNames.add(fieldName);
        children.add(child);
    }

    public String getType() {
        return type;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    /** Zero-based row of the first byte. */
    public int getStartRow() {
        return startRow;
    }

    /** Zero-based byte column of the first byte. */
    public int getStartColumn() {
        return startColumn;
    }

    public boolean isNamed() {
        return named;
    }

    public boolean isMissing() {
        return missing;
    }

    public boolean isError() {
        return "ERROR".equals(type);
    }

    public SyntaxNode getParent() {
        return parent;
    }

    public SourceText getSource() {
        return source;
    }

    public String getText() {
        return source.substring(startIndex, endIndex);
    }

    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public int getChildCount() {
        return children.size();
    }

    public SyntaxNode getChild(int index) {
        return children.get(index);
    }

    public List<SyntaxNode> getNamedChildren() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.named) result.add(child);
        }
        return result;
    }

    public int getNamedChildCount() {
        int count = 0;
        for (SyntaxNode child : children) {
            if (child.named) count++;
        }
        return count;
    }

    public SyntaxNode getNamedChild(int index) {
        int seen = 0;
        for (SyntaxNode child : children) {
            if (!child.named) continue;
            if (seen == index) return child;
            seen++;
        }
        return null;
    }

    /**
     * First child registered under {@code fieldName}, or null.
     */
    public SyntaxNode getChildByFieldName(String fieldName) {
        for (int i = 0; i < children.size(); i++) {
            if (fieldName.equals(fieldNames.get(i))) {
                return children.get(i);
            }
        }
        return null;
    }

    /**
     * First anonymous child whose text is exactly {@code token}, e.g. "{" or "default".
     */
    public SyntaxNode findToken(String token) {
        for (SyntaxNode child : children) {
            if (!child.named && token.equals(child.type)) return child;
        }
        return null;
    }

    public boolean hasError() {
        if (isError() || missing) return true;
        for (SyntaxNode child : children) {
            if (child.hasError()) return true;
        }
        return false;
    }

    public boolean contains(SyntaxNode other) {
        return other != null && other.source == source
                && startIndex <= other.startIndex && other.endIndex <= endIndex;
    }

    @Override
    public String toString() {
        return type + " [" + startIndex + ", " + endIndex + ")";
    }
}
