package org.dxworks.codemod.request;

import static org.dxworks.codemod.query.TreeHelper.isValidIdentifier;

/**
 * A {@code useState} declaration to add. The setter defaults to {@code set<Name>}; a null initial
 * value renders {@code useState()}.
 */
public class StateVariableSpec {
    private final String name;
    private final String setter;
    private final String initialValue;
    private final String component;

    public StateVariableSpec(String name, String setter, String initialValue) {
        this(name, setter, initialValue, null);
    }

    public StateVariableSpec(String name, String setter, String initialValue, String component) {
        if (!isValidIdentifier(name)) {
            throw new IllegalArgumentException("Invalid state variable name: " + name);
        }
        String resolvedSetter = setter == null || setter.isBlank()
                ? "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1)
                : setter;
        if (!isValidIdentifier(resolvedSetter)) {
            throw new IllegalArgumentException("Invalid state setter name: " + setter);
        }
        this.name = name;
        this.setter = resolvedSetter;
        this.initialValue = initialValue;
        this.component = component;
    }

    public String getName() {
        return name;
    }

    public String getSetter() {
        return setter;
    }

    public String getInitialValue() {
        return initialValue;
    }

    /** Target component function, or null for the default export. */
    public String getComponent() {
        return component;
    }
}
