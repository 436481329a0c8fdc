package org.dxworks.codemod.request;

/**
 * Exact, case-sensitive replacement of every occurrence of {@code searchFor}.
 */
public class ReplaceText implements ModificationRequest {
    private final String searchFor;
    private final String replaceWith;

    public ReplaceText(String searchFor, String replaceWith) {
        if (searchFor == null || searchFor.isEmpty()) {
            throw new IllegalArgumentException("Text to search for must not be empty");
        }
        this.searchFor = searchFor;
        this.replaceWith = replaceWith == null ? "" : replaceWith;
    }

    public String getSearchFor() {
        return searchFor;
    }

    public String getReplaceWith() {
        return replaceWith;
    }

    @Override
    public RequestType getType() {
        return RequestType.REPLACE_TEXT;
    }

    @Override
    public String describe() {
        return "replace text '" + TextPatch.excerpt(searchFor) + "'";
    }
}
