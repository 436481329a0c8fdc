package org.dxworks.codemod.query;

import org.dxworks.codemod.parser.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeHelper {

    private static final String[] JSX_NAME_TYPES = {
            "identifier", "jsx_identifier", "member_expression", "nested_identifier", "jsx_namespace_name"
    };

    public static String getNodeText(SyntaxNode node) {
        if (node == null) return null;
        return node.getText();
    }

    /**
     * Collapse all whitespace (including newlines and tabs) to single spaces and trim.
     */
    public static String normalizeInline(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s+", " ").trim();
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(SyntaxNode node, String... types) {
        if (node == null) return false;
        return isTypeOneOf(node.getType(), types);
    }

    public static SyntaxNode findFirstChild(SyntaxNode parent, String nodeType) {
        if (parent == null) return null;
        for (SyntaxNode child : parent.getChildren()) {
            if (child.isNamed() && nodeType.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static SyntaxNode getFirstChildOfTypes(SyntaxNode parent, String... types) {
        if (parent == null) return null;
        for (SyntaxNode child : parent.getChildren()) {
            if (child.isNamed() && isTypeOneOf(child.getType(), types)) {
                return child;
            }
        }
        return null;
    }

    public static List<SyntaxNode> findAllChildren(SyntaxNode parent, String nodeType) {
        List<SyntaxNode> result = new ArrayList<>();
        if (parent == null) return result;
        for (SyntaxNode child : parent.getChildren()) {
            if (child.isNamed() && nodeType.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Pre-order search of {@code root} and all of its descendants, anonymous nodes included.
     */
    public static List<SyntaxNode> findAllDescendantsOfTypes(SyntaxNode root, String... types) {
        List<SyntaxNode> result = new ArrayList<>();
        if (root == null) return result;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (isTypeOneOf(node.getType(), types)) result.add(node);
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
        }
        return result;
    }

    public static List<SyntaxNode> findAllDescendants(SyntaxNode root, String nodeType) {
        return findAllDescendantsOfTypes(root, nodeType);
    }

    public static boolean isSelfClosing(SyntaxNode node) {
        return node != null && "jsx_self_closing_element".equals(node.getType());
    }

    /**
     * The node carrying the tag name and attributes: the opening element of a
     * {@code jsx_element}, or the self-closing element itself.
     */
    public static SyntaxNode getOpeningTag(SyntaxNode element) {
        if (element == null) return null;
        if (isSelfClosing(element)) return element;
        if (!"jsx_element".equals(element.getType())) return null;
        SyntaxNode byField = element.getChildByFieldName("open_tag");
        if (byField != null) return byField;
        return findFirstChild(element, "jsx_opening_element");
    }

    public static SyntaxNode getClosingTag(SyntaxNode element) {
        if (element == null || !"jsx_element".equals(element.getType())) return null;
        SyntaxNode byField = element.getChildByFieldName("close_tag");
        if (byField != null) return byField;
        return findFirstChild(element, "jsx_closing_element");
    }

    public static SyntaxNode getTagNameNode(SyntaxNode element) {
        SyntaxNode tag = getOpeningTag(element);
        if (tag == null) return null;
        SyntaxNode byField = tag.getChildByFieldName("name");
        if (byField != null) return byField;
        return getFirstChildOfTypes(tag, JSX_NAME_TYPES);
    }

    public static String getTagName(SyntaxNode element) {
        return getNodeText(getTagNameNode(element));
    }

    public static List<SyntaxNode> getAttributes(SyntaxNode element) {
        return findAllChildren(getOpeningTag(element), "jsx_attribute");
    }

    public static String getAttributeName(SyntaxNode attribute) {
        SyntaxNode name = attribute.getNamedChild(0);
        return name != null ? name.getText() : null;
    }

    /**
     * The value node after "=", or null for a bare boolean attribute.
     */
    public static SyntaxNode getAttributeValue(SyntaxNode attribute) {
        return attribute.getNamedChildCount() > 1 ? attribute.getNamedChild(1) : null;
    }

    public static SyntaxNode findAttribute(SyntaxNode element, String name) {
        for (SyntaxNode attribute : getAttributes(element)) {
            if (name.equals(getAttributeName(attribute))) {
                return attribute;
            }
        }
        return null;
    }

    /**
     * Name of the function a call expression invokes; for member calls such as
     * {@code React.useState(...)} this is the property name.
     */
    public static String getCalleeName(SyntaxNode callExpression) {
        if (callExpression == null || !"call_expression".equals(callExpression.getType())) return null;
        SyntaxNode callee = callExpression.getChildByFieldName("function");
        if (callee == null) callee = callExpression.getNamedChild(0);
        if (callee == null) return null;
        if ("member_expression".equals(callee.getType())) {
            SyntaxNode property = callee.getChildByFieldName("property");
            return property != null ? property.getText() : null;
        }
        return callee.getText();
    }

    /**
     * Checks if a string is a valid identifier (for JS/TS style identifiers).
     */
    public static boolean isValidIdentifier(String name) {
        return name != null && name.matches("[a-zA-Z_$][a-zA-Z0-9_$]*");
    }

    /**
     * React's convention: hooks are functions named {@code use} followed by an uppercase letter.
     */
    public static boolean isHookName(String name) {
        return name != null && name.matches("use[A-Z0-9].*");
    }
}
