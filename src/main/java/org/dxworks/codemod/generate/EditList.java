package org.dxworks.codemod.generate;

import org.dxworks.codemod.model.ErrorKind;
import org.dxworks.codemod.model.ModificationException;
import org.dxworks.codemod.model.TextEdit;
import org.dxworks.codemod.parser.SourceText;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-overlapping edits against one source buffer. An insertion exactly at the boundary of a
 * replaced range does not overlap it, unless the replacement removes the node the insertion is
 * anchored to.
 */
public class EditList {
    private final List<TextEdit> edits = new ArrayList<>();

    public void add(TextEdit edit) {
        addAll(List.of(edit));
    }

    /**
     * Adds all edits or none of them.
     *
     * @throws ModificationException with {@link ErrorKind#RANGE_CONFLICT} if any edit overlaps an
     *                               accepted one or another edit of the same batch
     */
    public void addAll(List<TextEdit> batch) {
        for (int i = 0; i < batch.size(); i++) {
            TextEdit edit = batch.get(i);
            for (TextEdit accepted : edits) {
                if (edit.overlaps(accepted)) {
                    throw conflict(edit, accepted);
                }
            }
            for (int j = 0; j < i; j++) {
                if (edit.overlaps(batch.get(j))) {
                    throw conflict(edit, batch.get(j));
                }
            }
        }
        edits.addAll(batch);
    }

    private static ModificationException conflict(TextEdit edit, TextEdit accepted) {
        return new ModificationException(ErrorKind.RANGE_CONFLICT,
                edit.getDescription() + " [" + edit.getStart() + ", " + edit.getEnd() + ") overlaps "
                        + accepted.getDescription() + " [" + accepted.getStart() + ", " + accepted.getEnd() + ")");
    }

    public List<TextEdit> getEdits() {
        List<TextEdit> sorted = new ArrayList<>(edits);
        sorted.sort(TextEdit.OUTPUT_ORDER);
        return Collections.unmodifiableList(sorted);
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int size() {
        return edits.size();
    }

    /**
     * Splices all edits into {@code source}, last edit first, so earlier offsets stay valid.
     */
    public String apply(SourceText source) {
        List<TextEdit> ordered = new ArrayList<>(getEdits());
        Collections.reverse(ordered);

        byte[] buffer = source.toByteArray();
        for (TextEdit edit : ordered) {
            if (edit.getEnd() > source.length()) {
                throw new IllegalStateException("Edit " + edit + " runs past the end of the source ("
                        + source.length() + " bytes)");
            }
            byte[] replacement = edit.getReplacement().getBytes(StandardCharsets.UTF_8);
            ByteArrayOutputStream out = new ByteArrayOutputStream(buffer.length + replacement.length);
            out.write(buffer, 0, edit.getStart());
            out.write(replacement, 0, replacement.length);
            out.write(buffer, edit.getEnd(), buffer.length - edit.getEnd());
            buffer = out.toByteArray();
        }
        return new String(buffer, StandardCharsets.UTF_8);
    }
}
