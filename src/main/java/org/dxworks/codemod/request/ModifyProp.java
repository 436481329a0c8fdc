package org.dxworks.codemod.request;

public class ModifyProp implements ModificationRequest {
    private final ElementTarget target;
    private final PropSpec prop;

    public ModifyProp(ElementTarget target, PropSpec prop) {
        if (target == null || prop == null) {
            throw new IllegalArgumentException("Prop change needs a target and a prop");
        }
        this.target = target;
        this.prop = prop;
    }

    public ElementTarget getTarget() {
        return target;
    }

    public PropSpec getProp() {
        return prop;
    }

    @Override
    public RequestType getType() {
        return RequestType.MODIFY_PROP;
    }

    @Override
    public String describe() {
        return prop.getAction().name().toLowerCase() + " prop '" + prop.getName() + "' on " + target.describe();
    }
}
