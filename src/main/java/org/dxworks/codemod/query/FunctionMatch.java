package org.dxworks.codemod.query;

import org.dxworks.codemod.parser.SyntaxNode;

/**
 * A function located by name: either a declaration, or a variable declarator whose value is an
 * arrow function or function expression.
 */
public class FunctionMatch {

    public enum Kind {
        FUNCTION_DECLARATION,
        ARROW_FUNCTION,
        FUNCTION_EXPRESSION
    }

    private final String name;
    private final Kind kind;
    private final SyntaxNode functionNode;
    private final SyntaxNode declarator;

    public FunctionMatch(String name, Kind kind, SyntaxNode functionNode, SyntaxNode declarator) {
        this.name = name;
        this.kind = kind;
        this.functionNode = functionNode;
        this.declarator = declarator;
    }

    /** May be null for an anonymous default export. */
    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public SyntaxNode getFunctionNode() {
        return functionNode;
    }

    /** The {@code variable_declarator} for arrow functions and function expressions, else null. */
    public SyntaxNode getDeclarator() {
        return declarator;
    }

    /**
     * The {@code statement_block} body, or null when the function has an expression body.
     */
    public SyntaxNode getBody() {
        SyntaxNode body = functionNode.getChildByFieldName("body");
        if (body == null) {
            body = TreeHelper.findFirstChild(functionNode, "statement_block");
        }
        if (body == null || !"statement_block".equals(body.getType())) {
            return null;
        }
        return body;
    }

    public String describe() {
        return name != null ? name : "<anonymous default export>";
    }
}
