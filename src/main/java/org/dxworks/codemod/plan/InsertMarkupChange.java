package org.dxworks.codemod.plan;

import com.fasterxml.jackson.annotation.JsonAlias;
import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.MarkupPosition;

public class InsertMarkupChange extends ElementChange {
    public MarkupPosition position;
    @JsonAlias("jsx")
    public String markup;

    @Override
    public void applyTo(ComponentModifier modifier) {
        if (position == null) {
            throw new IllegalArgumentException(type + " requires position");
        }
        modifier.insertMarkup(target(), position, markup);
    }
}
