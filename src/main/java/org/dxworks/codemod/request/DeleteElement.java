package org.dxworks.codemod.request;

import org.dxworks.codemod.query.ElementLocator;

public class DeleteElement implements ModificationRequest {
    private final ElementLocator locator;

    public DeleteElement(ElementLocator locator) {
        if (locator == null) throw new IllegalArgumentException("Element locator is required");
        this.locator = locator;
    }

    public ElementLocator getLocator() {
        return locator;
    }

    @Override
    public RequestType getType() {
        return RequestType.DELETE_ELEMENT;
    }

    @Override
    public String describe() {
        return "delete " + locator.describe();
    }
}
