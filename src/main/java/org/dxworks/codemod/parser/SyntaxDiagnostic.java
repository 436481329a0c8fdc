package org.dxworks.codemod.parser;

public class SyntaxDiagnostic {
    public static final String MISMATCHED_TAG = "mismatched_closing_tag";

    public final int line;
    public final int column;
    public final String nodeType;
    public final String text;

    public SyntaxDiagnostic(int line, int column, String nodeType, String text) {
        this.line = line;
        this.column = column;
        this.nodeType = nodeType;
        this.text = text;
    }

    public String describe() {
        String kind;
        if ("ERROR".equals(nodeType)) {
            kind = "unexpected";
        } else if (MISMATCHED_TAG.equals(nodeType)) {
            kind = "closing tag does not match";
        } else {
            kind = "missing " + nodeType;
        }
        return "Syntax error at " + line + ":" + column + " (" + kind + "): " + text;
    }

    @Override
    public String toString() {
        return describe();
    }
}
