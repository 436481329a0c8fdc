package org.dxworks.codemod.request;

public class ModifyClassName implements ModificationRequest {
    private final ElementTarget target;
    private final ClassNameSpec spec;

    public ModifyClassName(ElementTarget target, ClassNameSpec spec) {
        if (target == null || spec == null) {
            throw new IllegalArgumentException("Class name change needs a target and a class spec");
        }
        this.target = target;
        this.spec = spec;
    }

    public ElementTarget getTarget() {
        return target;
    }

    public ClassNameSpec getSpec() {
        return spec;
    }

    @Override
    public RequestType getType() {
        return RequestType.MODIFY_CLASS_NAME;
    }

    @Override
    public String describe() {
        return "change className (" + spec.describe() + ") on " + target.describe();
    }
}
