package org.dxworks.codemod.request;

/**
 * A line-oriented textual edit applied after the structural edits.
 */
public class TextPatch {
    private static final int EXCERPT_LENGTH = 50;

    public enum Kind {
        /** Insert content on the line after the one containing the first match. */
        INSERT_AFTER,
        /** Insert content on its own line before the line containing the first match. */
        INSERT_BEFORE,
        /** Remove the line(s) spanned by the first match. */
        DELETE,
        /** Add content at the end of the file. */
        APPEND
    }

    private final Kind kind;
    private final String searchFor;
    private final String content;

    public TextPatch(Kind kind, String searchFor, String content) {
        if (kind == null) throw new IllegalArgumentException("Patch kind is required");
        if (kind != Kind.APPEND && (searchFor == null || searchFor.isEmpty())) {
            throw new IllegalArgumentException(kind + " patch needs text to search for");
        }
        if (kind != Kind.DELETE && content == null) {
            throw new IllegalArgumentException(kind + " patch needs content");
        }
        this.kind = kind;
        this.searchFor = searchFor;
        this.content = content;
    }

    public static TextPatch insertAfter(String searchFor, String content) {
        return new TextPatch(Kind.INSERT_AFTER, searchFor, content);
    }

    public static TextPatch insertBefore(String searchFor, String content) {
        return new TextPatch(Kind.INSERT_BEFORE, searchFor, content);
    }

    public static TextPatch deleteLine(String searchFor) {
        return new TextPatch(Kind.DELETE, searchFor, null);
    }

    public static TextPatch append(String content) {
        return new TextPatch(Kind.APPEND, null, content);
    }

    public Kind getKind() {
        return kind;
    }

    public String getSearchFor() {
        return searchFor;
    }

    public String getContent() {
        return content;
    }

    public static String excerpt(String text) {
        return text.length() > EXCERPT_LENGTH ? text.substring(0, EXCERPT_LENGTH) + "..." : text;
    }
}
