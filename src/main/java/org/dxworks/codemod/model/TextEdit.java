package org.dxworks.codemod.model;

import java.util.Comparator;

/**
 * A replacement of the UTF-8 byte range {@code [start, end)} of the original source.
 * An empty range is an insertion. An insertion may be anchored to the range of the node it was
 * placed against; a replacement covering that whole range removes the anchor and conflicts with it.
 */
public class TextEdit {

    /**
     * Order in which edits appear in the output: by position, insertions ahead of a replacement
     * starting at the same offset, then by priority (higher first), then by queue order.
     */
    public static final Comparator<TextEdit> OUTPUT_ORDER = Comparator
            .comparingInt(TextEdit::getStart)
            .thenComparing(TextEdit::isInsertion, Comparator.reverseOrder())
            .thenComparing(TextEdit::getPriority, Comparator.reverseOrder())
            .thenComparingInt(TextEdit::getSequence);

    private final int start;
    private final int end;
    private final String replacement;
    private final int priority;
    private final int sequence;
    private final String description;
    private int anchorStart = -1;
    private int anchorEnd = -1;

    public TextEdit(int start, int end, String replacement, int priority, int sequence, String description) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid edit range [" + start + ", " + end + ") for: " + description);
        }
        this.start = start;
        this.end = end;
        this.replacement = replacement;
        this.priority = priority;
        this.sequence = sequence;
        this.description = description;
    }

    public static TextEdit insert(int offset, String text, int priority, int sequence, String description) {
        return new TextEdit(offset, offset, text, priority, sequence, description);
    }

    public static TextEdit replace(int start, int end, String text, int priority, int sequence, String description) {
        return new TextEdit(start, end, text, priority, sequence, description);
    }

    public TextEdit anchoredTo(int nodeStart, int nodeEnd) {
        if (nodeStart < 0 || nodeEnd <= nodeStart) {
            throw new IllegalArgumentException("Invalid anchor [" + nodeStart + ", " + nodeEnd + ") for: " + description);
        }
        TextEdit anchored = new TextEdit(start, end, replacement, priority, sequence, description);
        anchored.anchorStart = nodeStart;
        anchored.anchorEnd = nodeEnd;
        return anchored;
    }

    public boolean isAnchored() {
        return anchorStart >= 0;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public String getReplacement() {
        return replacement;
    }

    public int getPriority() {
        return priority;
    }

    public int getSequence() {
        return sequence;
    }

    public String getDescription() {
        return description;
    }

    public boolean isInsertion() {
        return start == end;
    }

    public boolean overlaps(TextEdit other) {
        if (isInsertion() && other.isInsertion()) {
            return false;
        }
        if (isInsertion()) {
            return other.start < start && start < other.end || other.removesAnchorOf(this);
        }
        if (other.isInsertion()) {
            return start < other.start && other.start < end || removesAnchorOf(other);
        }
        return start < other.end && other.start < end;
    }

    private boolean removesAnchorOf(TextEdit insertion) {
        return insertion.isAnchored() && start <= insertion.anchorStart && insertion.anchorEnd <= end;
    }

    @Override
    public String toString() {
        return description + " [" + start + ", " + end + ")";
    }
}
