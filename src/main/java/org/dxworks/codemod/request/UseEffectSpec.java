package org.dxworks.codemod.request;

import java.util.List;

/**
 * Body of an effect to add. {@code dependencies == null} omits the dependency array; an empty
 * list renders {@code []}.
 */
public class UseEffectSpec {
    private final String body;
    private final List<String> dependencies;
    private final String cleanup;
    private final String component;

    public UseEffectSpec(String body, List<String> dependencies) {
        this(body, dependencies, null, null);
    }

    public UseEffectSpec(String body, List<String> dependencies, String cleanup, String component) {
        if (body == null) throw new IllegalArgumentException("Effect body is required");
        this.body = body;
        this.dependencies = dependencies == null ? null : List.copyOf(dependencies);
        this.cleanup = cleanup;
        this.component = component;
    }

    public String getBody() {
        return body;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public String getCleanup() {
        return cleanup;
    }

    public String getComponent() {
        return component;
    }
}
