package org.dxworks.codemod.model;

public class ModificationError {
    public final ErrorKind kind;
    public final String message;

    public ModificationError(ErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public String render() {
        return kind.getLabel() + ": " + message;
    }

    @Override
    public String toString() {
        return render();
    }
}
