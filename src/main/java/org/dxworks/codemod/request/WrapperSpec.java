package org.dxworks.codemod.request;

import org.dxworks.codemod.imports.ImportSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The component a target is wrapped in. Prop values are JSX expressions and render as
 * {@code key={value}}; insertion order is kept.
 */
public class WrapperSpec {
    private final String component;
    private final Map<String, String> props;
    private final ImportSpec importSpec;

    public WrapperSpec(String component, Map<String, String> props, ImportSpec importSpec) {
        if (component == null || !component.matches("[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$]*)*")) {
            throw new IllegalArgumentException("Invalid wrapper component: " + component);
        }
        this.component = component;
        this.props = props == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        this.importSpec = importSpec;
    }

    public static WrapperSpec of(String component) {
        return new WrapperSpec(component, null, null);
    }

    public String getComponent() {
        return component;
    }

    public Map<String, String> getProps() {
        return props;
    }

    /** Import to queue for the wrapper, or null. */
    public ImportSpec getImportSpec() {
        return importSpec;
    }
}
