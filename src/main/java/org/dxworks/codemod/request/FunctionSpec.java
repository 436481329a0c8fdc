package org.dxworks.codemod.request;

import java.util.List;

import static org.dxworks.codemod.query.TreeHelper.isValidIdentifier;

/**
 * A helper function declared inside a component, rendered as {@code const name = (params) => {...};}
 * or, when {@code arrow} is false, as a function declaration.
 */
public class FunctionSpec {
    private final String name;
    private final List<String> params;
    private final String body;
    private final boolean arrow;
    private final boolean async;
    private final String component;

    public FunctionSpec(String name, List<String> params, String body, boolean arrow, boolean async, String component) {
        if (!isValidIdentifier(name)) {
            throw new IllegalArgumentException("Invalid function name: " + name);
        }
        this.name = name;
        this.params = params == null ? List.of() : List.copyOf(params);
        this.body = body == null ? "" : body;
        this.arrow = arrow;
        this.async = async;
        this.component = component;
    }

    public static FunctionSpec arrow(String name, List<String> params, String body) {
        return new FunctionSpec(name, params, body, true, false, null);
    }

    public String getName() {
        return name;
    }

    public List<String> getParams() {
        return params;
    }

    public String getBody() {
        return body;
    }

    public boolean isArrow() {
        return arrow;
    }

    public boolean isAsync() {
        return async;
    }

    public String getComponent() {
        return component;
    }
}
