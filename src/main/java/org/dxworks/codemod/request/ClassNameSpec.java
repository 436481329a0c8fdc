package org.dxworks.codemod.request;

import java.util.List;

/**
 * Token-level change of a {@code className} attribute. Static classes are added or removed; an
 * optional condition appends {@code ${condition ? 'whenTrue' : 'whenFalse'}} inside a template literal.
 */
public class ClassNameSpec {
    private final List<String> add;
    private final List<String> remove;
    private final String condition;
    private final String whenTrue;
    private final String whenFalse;

    public ClassNameSpec(List<String> add, List<String> remove, String condition, String whenTrue, String whenFalse) {
        this.add = add == null ? List.of() : List.copyOf(add);
        this.remove = remove == null ? List.of() : List.copyOf(remove);
        for (String token : this.add) {
            if (token.isBlank() || token.matches(".*[\\s'\"`].*")) {
                throw new IllegalArgumentException("Invalid class name: '" + token + "'");
            }
        }
        if (condition != null && condition.isBlank()) {
            throw new IllegalArgumentException("Conditional class needs a condition");
        }
        if (condition != null && (whenTrue == null || whenTrue.isBlank())) {
            throw new IllegalArgumentException("Conditional class needs a class for the true branch");
        }
        if (this.add.isEmpty() && this.remove.isEmpty() && condition == null) {
            throw new IllegalArgumentException("Class name change adds, removes or conditions nothing");
        }
        this.condition = condition;
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse == null ? "" : whenFalse;
    }

    public static ClassNameSpec add(String... classes) {
        return new ClassNameSpec(List.of(classes), null, null, null, null);
    }

    public static ClassNameSpec remove(String... classes) {
        return new ClassNameSpec(null, List.of(classes), null, null, null);
    }

    public static ClassNameSpec conditional(String condition, String whenTrue, String whenFalse) {
        return new ClassNameSpec(null, null, condition, whenTrue, whenFalse);
    }

    public List<String> getAdd() {
        return add;
    }

    public List<String> getRemove() {
        return remove;
    }

    /** JavaScript expression choosing the conditional class, or null. */
    public String getCondition() {
        return condition;
    }

    public String getWhenTrue() {
        return whenTrue;
    }

    public String getWhenFalse() {
        return whenFalse;
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        if (!add.isEmpty()) sb.append("+").append(String.join(" +", add));
        if (!remove.isEmpty()) sb.append(sb.length() > 0 ? " " : "").append("-").append(String.join(" -", remove));
        if (condition != null) sb.append(sb.length() > 0 ? " " : "").append("if ").append(condition);
        return sb.toString();
    }
}
