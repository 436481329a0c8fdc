package org.dxworks.codemod.request;

import java.util.List;

import static org.dxworks.codemod.query.TreeHelper.isValidIdentifier;

/**
 * A {@code useRef}, {@code useMemo} or {@code useCallback} binding.
 * <ul>
 *     <li>REF: {@code value} is the initial value (may be null)</li>
 *     <li>MEMO: {@code value} is the computed expression</li>
 *     <li>CALLBACK: {@code value} is the callback body, {@code params} its parameter list</li>
 * </ul>
 */
public class HookVariableSpec {
    private final HookKind kind;
    private final String name;
    private final String value;
    private final List<String> dependencies;
    private final List<String> params;
    private final String component;

    public HookVariableSpec(HookKind kind, String name, String value, List<String> dependencies,
                            List<String> params, String component) {
        if (kind == null) throw new IllegalArgumentException("Hook kind is required");
        if (!isValidIdentifier(name)) {
            throw new IllegalArgumentException("Invalid " + kind.getHookName() + " variable name: " + name);
        }
        if (kind != HookKind.REF && value == null) {
            throw new IllegalArgumentException(kind.getHookName() + " needs a value");
        }
        this.kind = kind;
        this.name = name;
        this.value = value;
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        this.params = params == null ? List.of() : List.copyOf(params);
        this.component = component;
    }

    public static HookVariableSpec ref(String name, String initialValue) {
        return new HookVariableSpec(HookKind.REF, name, initialValue, null, null, null);
    }

    public static HookVariableSpec memo(String name, String computation, List<String> dependencies) {
        return new HookVariableSpec(HookKind.MEMO, name, computation, dependencies, null, null);
    }

    public static HookVariableSpec callback(String name, List<String> params, String body, List<String> dependencies) {
        return new HookVariableSpec(HookKind.CALLBACK, name, body, dependencies, params, null);
    }

    public HookVariableSpec inComponent(String component) {
        return new HookVariableSpec(kind, name, value, dependencies, params, component);
    }

    public HookKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public List<String> getParams() {
        return params;
    }

    public String getComponent() {
        return component;
    }
}
