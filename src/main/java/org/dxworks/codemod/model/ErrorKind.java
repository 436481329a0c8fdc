package org.dxworks.codemod.model;

/**
 * Categories of problems collected while generating code.
 * Only the parse and generation kinds make a result unsuccessful.
 */
public enum ErrorKind {
    PARSE_FAILURE("ParseFailure", true),
    IMPORT_CONFLICT("ImportConflict", false),
    TARGET_NOT_FOUND("TargetNotFound", false),
    TEXT_NOT_FOUND("TextNotFound", false),
    RANGE_CONFLICT("RangeConflict", false),
    DUPLICATE_DECLARATION("DuplicateDeclaration", false),
    SYNTAX_ERROR("SyntaxError", false),
    GENERATION_FAILURE("GenerationFailure", true);

    private final String label;
    private final boolean fatal;

    ErrorKind(String label, boolean fatal) {
        this.label = label;
        this.fatal = fatal;
    }

    public String getLabel() {
        return label;
    }

    public boolean isFatal() {
        return fatal;
    }
}
