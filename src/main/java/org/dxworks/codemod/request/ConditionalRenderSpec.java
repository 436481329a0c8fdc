package org.dxworks.codemod.request;

/**
 * Makes a component's returned markup depend on {@code condition}.
 * <ul>
 *     <li>EARLY_RETURN: {@code if (!condition) { return fallback; }} goes before the return</li>
 *     <li>TERNARY: the returned expression becomes {@code condition ? expression : fallback}</li>
 * </ul>
 * A null fallback renders {@code null}.
 */
public class ConditionalRenderSpec {

    public enum Style {
        EARLY_RETURN,
        TERNARY
    }

    private final String condition;
    private final String fallback;
    private final Style style;
    private final String component;

    public ConditionalRenderSpec(String condition, String fallback, Style style, String component) {
        if (condition == null || condition.isBlank()) {
            throw new IllegalArgumentException("Conditional render needs a condition");
        }
        this.condition = condition.trim();
        this.fallback = fallback == null || fallback.isBlank() ? "null" : fallback.trim();
        this.style = style == null ? Style.TERNARY : style;
        this.component = component;
    }

    public static ConditionalRenderSpec earlyReturn(String condition, String fallback) {
        return new ConditionalRenderSpec(condition, fallback, Style.EARLY_RETURN, null);
    }

    public static ConditionalRenderSpec ternary(String condition, String fallback) {
        return new ConditionalRenderSpec(condition, fallback, Style.TERNARY, null);
    }

    public String getCondition() {
        return condition;
    }

    public String getFallback() {
        return fallback;
    }

    public Style getStyle() {
        return style;
    }

    /** Target component function, or null for the default export. */
    public String getComponent() {
        return component;
    }
}
