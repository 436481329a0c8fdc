package org.dxworks.codemod.parser;

import org.dxworks.codemod.Dialect;
import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.ModificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses component sources with tree-sitter and copies the native tree into an immutable
 * {@link SyntaxTree}. A parser instance is not thread-safe; use one per session.
 */
public class ComponentParser {
    private static final Logger LOG = LoggerFactory.getLogger(ComponentParser.class);
    private static final int MAX_EXCERPT_LENGTH = 50;

    private final Dialect dialect;
    private final TSParser parser;

    public ComponentParser(Dialect dialect) {
        this.dialect = dialect;
        this.parser = new TSParser();
        this.parser.setLanguage(dialect.newTreeSitterLanguage());
    }

    public Dialect getDialect() {
        return dialect;
    }

    /**
     * @throws ModificationException with {@link ErrorKind#PARSE_FAILURE} when tree-sitter
     *                               produces no tree at all
     */
    public SyntaxTree parse(String sourceCode) {
        SourceText source = new SourceText(sourceCode);
        TSTree tree = parser.parseString(null, sourceCode);
        if (tree == null) {
            throw new ModificationException(ErrorKind.PARSE_FAILURE,
                    "Failed to parse " + dialect.getName() + " source");
        }
        TSNode rootNode = tree.getRootNode();
        if (rootNode == null || rootNode.isNull()) {
            throw new ModificationException(ErrorKind.PARSE_FAILURE,
                    "Failed to parse " + dialect.getName() + " source: empty tree");
        }

        SyntaxNode root = snapshot(source, rootNode, null);
        List<SyntaxDiagnostic> diagnostics = collectDiagnostics(root);
        if (!diagnostics.isEmpty()) {
            LOG.debug("Parsed {} bytes with {} syntax problem(s), first: {}",
                    source.length(), diagnostics.size(), diagnostics.get(0));
        }
        return new SyntaxTree(dialect, source, root, diagnostics);
    }

    private SyntaxNode snapshot(SourceText source, TSNode node, SyntaxNode parent) {
        TSPoint start = node.getStartPoint();
        SyntaxNode copy = new SyntaxNode(source, node.getType(), node.getStartByte(), node.getEndByte(),
                start.getRow(), start.getColumn(), node.isNamed(), node.isMissing(), parent);
        // getFieldNameForChild expects the index among all children, anonymous ones included
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;
            copy.addChild(fieldNameForChild(node, i), snapshot(source, child, copy));
        }
        return copy;
    }

    private static String fieldNameForChild(TSNode node, int index) {
        try {
            return node.getFieldNameForChild(index);
        } catch (RuntimeException e) {
            LOG.trace("No field name for child {} of {}", index, node.getType(), e);
            return null;
        }
    }

    static List<SyntaxDiagnostic> collectDiagnostics(SyntaxNode root) {
        List<SyntaxDiagnostic> diagnostics = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.isError() || node.isMissing()) {
                report(node, node.getType(), diagnostics, seen);
            } else if ("jsx_element".equals(node.getType())) {
                SyntaxNode closing = mismatchedClosingTag(node);
                if (closing != null) {
                    report(closing, SyntaxDiagnostic.MISMATCHED_TAG, diagnostics, seen);
                }
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                stack.push(node.getChild(i));
            }
        }
        return diagnostics;
    }

    private static void report(SyntaxNode node, String kind, List<SyntaxDiagnostic> diagnostics, Set<String> seen) {
        String key = node.getStartRow() + ":" + node.getStartColumn() + ":" + kind;
        if (!seen.add(key)) return;
        String text = node.getText();
        if (text.length() > MAX_EXCERPT_LENGTH) {
            text = text.substring(0, MAX_EXCERPT_LENGTH);
        }
        diagnostics.add(new SyntaxDiagnostic(node.getStartRow() + 1, node.getStartColumn() + 1, kind, text));
    }

    /**
     * tree-sitter accepts {@code <A></B>} without an error node, so closing names are compared here.
     * Returns the closing tag when it names a different element than the opening tag.
     */
    private static SyntaxNode mismatchedClosingTag(SyntaxNode element) {
        SyntaxNode opening = tagOf(element, "open_tag", "jsx_opening_element");
        SyntaxNode closing = tagOf(element, "close_tag", "jsx_closing_element");
        if (opening == null || closing == null || closing.isMissing()) return null;
        String openingName = tagName(opening);
        String closingName = tagName(closing);
        if (openingName == null ? closingName == null : openingName.equals(closingName)) return null;
        return closing;
    }

    private static SyntaxNode tagOf(SyntaxNode element, String field, String type) {
        SyntaxNode byField = element.getChildByFieldName(field);
        if (byField != null) return byField;
        for (SyntaxNode child : element.getChildren()) {
            if (type.equals(child.getType())) return child;
        }
        return null;
    }

    private static String tagName(SyntaxNode tag) {
        SyntaxNode name = tag.getChildByFieldName("name");
        if (name == null && tag.getNamedChildCount() > 0 && !"jsx_attribute".equals(tag.getNamedChild(0).getType())) {
            name = tag.getNamedChild(0);
        }
        return name == null ? null : name.getText().replaceAll("\\s+", "");
    }
}
