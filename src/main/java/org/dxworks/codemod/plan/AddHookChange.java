package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.HookKind;
import org.dxworks.codemod.request.HookVariableSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code ADD_REF}, {@code ADD_MEMO} and {@code ADD_CALLBACK}. {@code value} is the initial value,
 * the memoized expression, or the callback body respectively.
 */
public class AddHookChange extends PlannedChange {
    public String name;
    public String value;
    public List<String> dependencies = new ArrayList<>();
    public List<String> params = new ArrayList<>();
    public String component;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(name, "name", type);
        modifier.addHookVariable(new HookVariableSpec(kind(), name, value, dependencies, params, component));
    }

    private HookKind kind() {
        switch (type) {
            case "ADD_REF":
                return HookKind.REF;
            case "ADD_MEMO":
                return HookKind.MEMO;
            case "ADD_CALLBACK":
                return HookKind.CALLBACK;
            default:
                throw new IllegalArgumentException("Not a hook change: " + type);
        }
    }
}
