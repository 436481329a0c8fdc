package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.TextPatch;

/**
 * {@code INSERT_AFTER}, {@code INSERT_BEFORE}, {@code DELETE} and {@code APPEND}.
 */
public class TextPatchChange extends PlannedChange {
    public String searchFor;
    public String content;

    @Override
    public void applyTo(ComponentModifier modifier) {
        modifier.patchText(new TextPatch(TextPatch.Kind.valueOf(type), searchFor, content));
    }
}
