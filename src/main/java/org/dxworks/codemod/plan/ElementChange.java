package org.dxworks.codemod.plan;

import com.fasterxml.jackson.annotation.JsonAlias;
import org.dxworks.codemod.query.ElementLocator;
import org.dxworks.codemod.request.ElementTarget;

/**
 * A change addressed at a JSX element by tag name, optional class/id identifier and optional
 * content substring.
 */
public abstract class ElementChange extends PlannedChange {
    @JsonAlias({"elementType", "tagName"})
    public String targetElement;
    public String identifier;
    public String content;

    protected ElementLocator locator() {
        require(targetElement, "targetElement", type);
        return new ElementLocator(targetElement, identifier, content);
    }

    protected ElementTarget target() {
        return ElementTarget.of(locator());
    }
}
