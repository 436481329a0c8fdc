package org.dxworks.codemod.request;

public class WrapElement implements ModificationRequest {
    private final ElementTarget target;
    private final WrapperSpec wrapper;

    public WrapElement(ElementTarget target, WrapperSpec wrapper) {
        if (target == null || wrapper == null) {
            throw new IllegalArgumentException("Wrap needs a target and a wrapper");
        }
        this.target = target;
        this.wrapper = wrapper;
    }

    public ElementTarget getTarget() {
        return target;
    }

    public WrapperSpec getWrapper() {
        return wrapper;
    }

    @Override
    public RequestType getType() {
        return RequestType.WRAP_ELEMENT;
    }

    @Override
    public String describe() {
        return "wrap " + target.describe() + " in <" + wrapper.getComponent() + ">";
    }
}
