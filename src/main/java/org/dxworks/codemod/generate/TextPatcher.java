package org.dxworks.codemod.generate;

import org.dxworks.codemod.request.TextPatch;

/**
 * Literal text edits used when a change has no structural target. Matching is exact and
 * case-sensitive; no whitespace normalization is applied.
 */
public class TextPatcher {

    private TextPatcher() {
    }

    /**
     * Replaces every occurrence of {@code searchFor}.
     *
     * @throws TextNotFoundException when {@code searchFor} does not occur in {@code text}
     */
    public static String replaceAll(String text, String searchFor, String replaceWith) {
        requireSearchText(searchFor);
        if (!text.contains(searchFor)) {
            throw new TextNotFoundException(searchFor);
        }
        return text.replace(searchFor, replaceWith);
    }

    /**
     * Puts {@code content} on its own line after the line holding the first match.
     */
    public static String insertAfter(String text, String searchFor, String content) {
        int index = indexOf(text, searchFor);
        int endOfLine = text.indexOf('\n', index + searchFor.length());
        if (endOfLine == -1) {
            String separator = text.endsWith("\n") ? "" : "\n";
            return text + separator + terminated(content);
        }
        int insertAt = endOfLine + 1;
        return text.substring(0, insertAt) + terminated(content) + text.substring(insertAt);
    }

    /**
     * Puts {@code content} on its own line before the line holding the first match.
     */
    public static String insertBefore(String text, String searchFor, String content) {
        int index = indexOf(text, searchFor);
        int startOfLine = text.lastIndexOf('\n', index - 1) + 1;
        return text.substring(0, startOfLine) + terminated(content) + text.substring(startOfLine);
    }

    /**
     * Removes every line touched by the first match, including the final line break.
     */
    public static String deleteLine(String text, String searchFor) {
        int index = indexOf(text, searchFor);
        int startOfLine = text.lastIndexOf('\n', index - 1) + 1;
        int endOfLine = text.indexOf('\n', index + searchFor.length());
        int deleteEnd = endOfLine == -1 ? text.length() : endOfLine + 1;
        return text.substring(0, startOfLine) + text.substring(deleteEnd);
    }

    public static String append(String text, String content) {
        String separator = text.isEmpty() || text.endsWith("\n") ? "" : "\n";
        return text + separator + content;
    }

    public static String apply(String text, TextPatch patch) {
        switch (patch.getKind()) {
            case INSERT_AFTER:
                return insertAfter(text, patch.getSearchFor(), patch.getContent());
            case INSERT_BEFORE:
                return insertBefore(text, patch.getSearchFor(), patch.getContent());
            case DELETE:
                return deleteLine(text, patch.getSearchFor());
            case APPEND:
                return append(text, patch.getContent());
            default:
                throw new IllegalArgumentException("Unknown patch kind: " + patch.getKind());
        }
    }

    private static int indexOf(String text, String searchFor) {
        requireSearchText(searchFor);
        int index = text.indexOf(searchFor);
        if (index == -1) {
            throw new TextNotFoundException(searchFor);
        }
        return index;
    }

    private static void requireSearchText(String searchFor) {
        if (searchFor == null || searchFor.isEmpty()) {
            throw new IllegalArgumentException("Text to search for must not be empty");
        }
    }

    private static String terminated(String content) {
        return content.endsWith("\n") ? content : content + "\n";
    }
}
