package org.dxworks.codemod.generate;

import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.ModificationException;
import org.dxworks.codemod.request.TextPatch;

public class TextNotFoundException extends ModificationException {
    private final String searchFor;

    public TextNotFoundException(String searchFor) {
        super(ErrorKind.TEXT_NOT_FOUND, "search text not found: \"" + TextPatch.excerpt(searchFor) + "\"");
        this.searchFor = searchFor;
    }

    public String getSearchFor() {
        return searchFor;
    }
}
