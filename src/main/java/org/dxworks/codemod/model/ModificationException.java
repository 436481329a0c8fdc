package org.dxworks.codemod.model;

/**
 * Raised when a single queued request cannot be resolved. The generator turns it into a
 * collected {@link ModificationError} and keeps processing the remaining requests.
 */
public class ModificationException extends RuntimeException {
    private final ErrorKind kind;

    public ModificationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ModificationError toError() {
        return new ModificationError(kind, getMessage());
    }
}
