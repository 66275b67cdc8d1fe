package io.sqlsugar.template;

import java.util.Objects;

public record Decision(String condition, Action action, String reason) {
    public enum Action {
        KEEP,
        REMOVE
    }

    public Decision {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(reason, "reason");
    }

    public static Decision keep(String condition, String reason) {
        return new Decision(condition, Action.KEEP, reason);
    }

    public static Decision remove(String condition, String reason) {
        return new Decision(condition, Action.REMOVE, reason);
    }
}
