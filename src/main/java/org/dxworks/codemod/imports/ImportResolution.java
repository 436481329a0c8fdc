package org.dxworks.codemod.imports;

import org.dxworks.codemod.model.ModificationError;
import org.dxworks.codemod.model.TextEdit;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of resolving the merged import request for one module source: at most one edit, plus
 * the conflicts that were dropped along the way.
 */
public class ImportResolution {
    private final String source;
    private final TextEdit edit;
    private final boolean newStatement;
    private final List<ModificationError> conflicts;

    ImportResolution(String source, TextEdit edit, boolean newStatement, List<ModificationError> conflicts) {
        this.source = source;
        this.edit = edit;
        this.newStatement = newStatement;
        this.conflicts = new ArrayList<>(conflicts);
    }

    public String getSource() {
        return source;
    }

    /** Null when the existing imports already cover the request. */
    public TextEdit getEdit() {
        return edit;
    }

    public boolean isNewStatement() {
        return newStatement;
    }

    public boolean isUnchanged() {
        return edit == null;
    }

    public List<ModificationError> getConflicts() {
        return conflicts;
    }
}
