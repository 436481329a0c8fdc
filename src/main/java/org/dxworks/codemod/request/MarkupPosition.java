package org.dxworks.codemod.request;

public enum MarkupPosition {
    BEFORE,
    AFTER,
    /** Right after the opening tag. */
    INSIDE_START,
    /** Right before the closing tag. */
    INSIDE_END
}
