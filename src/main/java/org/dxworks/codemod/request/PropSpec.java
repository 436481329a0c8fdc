package org.dxworks.codemod.request;

/**
 * A JSX attribute change. Values wrapped in double quotes are written as string literals,
 * anything else as a {@code {expression}}.
 */
public class PropSpec {

    public enum Action {
        ADD,
        UPDATE,
        REMOVE
    }

    private final String name;
    private final String value;
    private final Action action;

    public PropSpec(String name, String value, Action action) {
        if (name == null || !name.matches("[A-Za-z_$][\\w$\\-:]*")) {
            throw new IllegalArgumentException("Invalid prop name: " + name);
        }
        if (action == null) throw new IllegalArgumentException("Prop action is required");
        if (action != Action.REMOVE && value == null) {
            throw new IllegalArgumentException("Prop '" + name + "' needs a value to " + action.name().toLowerCase());
        }
        this.name = name;
        this.value = value;
        this.action = action;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public Action getAction() {
        return action;
    }

    public String render() {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return name + "=" + value;
        }
        return name + "={" + value + "}";
    }
}
