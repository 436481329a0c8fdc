package org.dxworks.codemod.request;

import org.dxworks.codemod.parser.SyntaxNode;
import org.dxworks.codemod.query.ElementLocator;

/**
 * Either a node taken from the session's tree, or a locator resolved when code is generated.
 */
public final class ElementTarget {
    private final SyntaxNode node;
    private final ElementLocator locator;

    private ElementTarget(SyntaxNode node, ElementLocator locator) {
        this.node = node;
        this.locator = locator;
    }

    public static ElementTarget of(SyntaxNode node) {
        if (node == null) throw new IllegalArgumentException("Target node is required");
        return new ElementTarget(node, null);
    }

    public static ElementTarget of(ElementLocator locator) {
        if (locator == null) throw new IllegalArgumentException("Target locator is required");
        return new ElementTarget(null, locator);
    }

    public static ElementTarget tag(String tagName) {
        return of(ElementLocator.tag(tagName));
    }

    public SyntaxNode getNode() {
        return node;
    }

    public ElementLocator getLocator() {
        return locator;
    }

    public String describe() {
        return node != null ? node.toString() : locator.describe();
    }
}
