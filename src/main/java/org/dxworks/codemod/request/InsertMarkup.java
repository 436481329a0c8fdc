package org.dxworks.codemod.request;

public class InsertMarkup implements ModificationRequest {
    private final ElementTarget target;
    private final MarkupPosition position;
    private final String markup;

    public InsertMarkup(ElementTarget target, MarkupPosition position, String markup) {
        if (target == null || position == null) {
            throw new IllegalArgumentException("Markup insertion needs a target and a position");
        }
        if (markup == null || markup.isBlank()) {
            throw new IllegalArgumentException("Markup to insert must not be blank");
        }
        this.target = target;
        this.position = position;
        this.markup = markup;
    }

    public ElementTarget getTarget() {
        return target;
    }

    public MarkupPosition getPosition() {
        return position;
    }

    public String getMarkup() {
        return markup;
    }

    @Override
    public RequestType getType() {
        return RequestType.INSERT_MARKUP;
    }

    @Override
    public String describe() {
        return "insert markup " + position + " " + target.describe();
    }
}
