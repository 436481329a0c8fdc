package org.dxworks.codemod.query;

import java.util.Objects;

/**
 * Semantic description of a JSX element: a tag name, optionally narrowed by an identifier
 * (substring of the className / class / id attribute) and by a content substring.
 */
public class ElementLocator {
    private final String tagName;
    private final String identifier;
    private final String content;

    public ElementLocator(String tagName, String identifier, String content) {
        if (tagName == null || tagName.isBlank()) {
            throw new IllegalArgumentException("Element locator needs a tag name");
        }
        this.tagName = tagName;
        this.identifier = identifier;
        this.content = content;
    }

    public static ElementLocator tag(String tagName) {
        return new ElementLocator(tagName, null, null);
    }

    public ElementLocator withIdentifier(String identifier) {
        return new ElementLocator(tagName, identifier, content);
    }

    public ElementLocator withContent(String content) {
        return new ElementLocator(tagName, identifier, content);
    }

    public String getTagName() {
        return tagName;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getContent() {
        return content;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder("<").append(tagName).append(">");
        if (identifier != null) sb.append(" with identifier '").append(identifier).append("'");
        if (content != null) sb.append(" containing '").append(content).append("'");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementLocator)) return false;
        ElementLocator that = (ElementLocator) o;
        return tagName.equals(that.tagName)
                && Objects.equals(identifier, that.identifier)
                && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, identifier, content);
    }

    @Override
    public String toString() {
        return describe();
    }
}
