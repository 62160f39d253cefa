package com.smartcampus.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Operations a principal can attempt on a resource.
 */
public enum Action {

    READ("read"),
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Whether the action changes state. Every attempted mutation is audited, allowed or not.
     */
    public boolean isMutation() {
        return this != READ;
    }

    public static Optional<Action> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Action action : values()) {
            if (action.value.equals(normalized)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
