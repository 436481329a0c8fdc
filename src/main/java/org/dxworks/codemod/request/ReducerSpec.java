package org.dxworks.codemod.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.dxworks.codemod.query.TreeHelper.isValidIdentifier;

/**
 * A {@code useReducer} binding together with the reducer function it uses. Each action type maps
 * to the statements of its {@code case}; unknown actions return the current state.
 */
public class ReducerSpec {
    private final String name;
    private final String dispatch;
    private final String reducerName;
    private final String initialState;
    private final Map<String, String> actions;
    private final String component;

    public ReducerSpec(String name, String dispatch, String reducerName, String initialState,
                       Map<String, String> actions, String component) {
        if (!isValidIdentifier(name)) {
            throw new IllegalArgumentException("Invalid reducer state name: " + name);
        }
        String resolvedDispatch = dispatch == null || dispatch.isBlank() ? "dispatch" : dispatch;
        String resolvedReducer = reducerName == null || reducerName.isBlank() ? name + "Reducer" : reducerName;
        if (!isValidIdentifier(resolvedDispatch)) {
            throw new IllegalArgumentException("Invalid dispatch name: " + dispatch);
        }
        if (!isValidIdentifier(resolvedReducer)) {
            throw new IllegalArgumentException("Invalid reducer function name: " + reducerName);
        }
        if (initialState == null || initialState.isBlank()) {
            throw new IllegalArgumentException("Reducer '" + name + "' needs an initial state");
        }
        this.name = name;
        this.dispatch = resolvedDispatch;
        this.reducerName = resolvedReducer;
        this.initialState = initialState;
        this.actions = actions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        for (String action : this.actions.keySet()) {
            if (action.isBlank() || action.contains("'") || action.contains("\\")) {
                throw new IllegalArgumentException("Invalid action type: '" + action + "'");
            }
        }
        this.component = component;
    }

    public static ReducerSpec of(String name, String initialState, Map<String, String> actions) {
        return new ReducerSpec(name, null, null, initialState, actions, null);
    }

    public String getName() {
        return name;
    }

    public String getDispatch() {
        return dispatch;
    }

    public String getReducerName() {
        return reducerName;
    }

    public String getInitialState() {
        return initialState;
    }

    /** Action type to case statements, in declaration order. */
    public Map<String, String> getActions() {
        return actions;
    }

    /** Target component function, or null for the default export. */
    public String getComponent() {
        return component;
    }
}
