package com.grcplatform.security.guard;

import com.grcplatform.security.permission.Action;

import java.util.List;

/**
 * Actions required on one resource type.
 */
public record PermissionRequirement(String resource, List<Action> actions) {

    public PermissionRequirement {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be blank");
        }
        actions = List.copyOf(actions);
    }

    public static PermissionRequirement of(String resource, Action... actions) {
        return new PermissionRequirement(resource, List.of(actions));
    }
}
