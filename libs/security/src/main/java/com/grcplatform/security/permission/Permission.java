package com.grcplatform.security.permission;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A grant of actions on a resource type.
 *
 * @param resource the resource type (e.g. "agents"), or {@link #ANY_RESOURCE}
 * @param actions  the granted actions, never empty
 */
public record Permission(String resource, Set<Action> actions) {

    /** Resource pattern matching every resource type. */
    public static final String ANY_RESOURCE = "*";

    public Permission {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be blank");
        }
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("actions must not be empty");
        }
        actions = Collections.unmodifiableSet(EnumSet.copyOf(actions));
    }

    public static Permission of(String resource, Action... actions) {
        return new Permission(resource, Set.of(actions));
    }

    /** Grants every action on the resource. */
    public static Permission all(String resource) {
        return new Permission(resource, EnumSet.allOf(Action.class));
    }

    public boolean matchesResource(String requested) {
        return ANY_RESOURCE.equals(resource) || resource.equals(requested);
    }

    /**
     * True when this permission grants {@code action} on {@code requested}.
     */
    public boolean allows(String requested, Action action) {
        if (!matchesResource(requested)) {
            return false;
        }
        for (Action held : actions) {
            if (held.covers(action)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return resource + ":" + actions.stream().map(Action::value).collect(Collectors.joining(","));
    }
}
