package org.dxworks.codemod.plan;

import org.dxworks.codemod.ComponentModifier;
import org.dxworks.codemod.request.ReducerSpec;

import java.util.LinkedHashMap;
import java.util.Map;

public class AddReducerChange extends PlannedChange {
    public String name;
    public String dispatch;
    public String reducer;
    public String initialState;
    /** Action type to the statements of its case; JSON object order is kept. */
    public Map<String, String> actions = new LinkedHashMap<>();
    public String component;

    @Override
    public void applyTo(ComponentModifier modifier) {
        require(name, "name", type);
        require(initialState, "initialState", type);
        modifier.addReducer(new ReducerSpec(name, dispatch, reducer, initialState, actions, component));
    }
}
