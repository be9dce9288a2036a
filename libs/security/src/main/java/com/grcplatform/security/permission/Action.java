package com.grcplatform.security.permission;

import java.util.Optional;

/**
 * Operations that can be granted on a resource. {@link #ADMIN} implies all other actions.
 */
public enum Action {

    READ("read"),
    WRITE("write"),
    DELETE("delete"),
    ADMIN("admin");

    private final String value;

    Action(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** True when holding this action grants {@code required}. */
    public boolean covers(Action required) {
        return this == required || this == ADMIN;
    }

    public static Optional<Action> fromString(String value) {
        for (Action action : values()) {
            if (action.value.equals(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
