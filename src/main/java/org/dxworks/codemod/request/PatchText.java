package org.dxworks.codemod.request;

public class PatchText implements ModificationRequest {
    private final TextPatch patch;

    public PatchText(TextPatch patch) {
        if (patch == null) throw new IllegalArgumentException("Text patch is required");
        this.patch = patch;
    }

    public TextPatch getPatch() {
        return patch;
    }

    @Override
    public RequestType getType() {
        return RequestType.PATCH_TEXT;
    }

    @Override
    public String describe() {
        String target = patch.getSearchFor() == null ? "end of file" : "'" + TextPatch.excerpt(patch.getSearchFor()) + "'";
        return patch.getKind().name().toLowerCase() + " patch at " + target;
    }
}
