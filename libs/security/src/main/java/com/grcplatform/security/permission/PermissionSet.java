package com.grcplatform.security.permission;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable, merged set of permissions.
 * <p>
 * Permissions for the same resource are unioned and the result is ordered by resource name, so
 * equal inputs always produce equal sets regardless of role order.
 */
public final class PermissionSet {

    public static final PermissionSet EMPTY = new PermissionSet(List.of());

    private final List<Permission> permissions;

    private PermissionSet(List<Permission> permissions) {
        this.permissions = permissions;
    }

    /**
     * Merges the given permissions into a set.
     */
    public static PermissionSet of(Collection<Permission> permissions) {
        Map<String, EnumSet<Action>> merged = new TreeMap<>();
        for (Permission p : permissions) {
            merged.computeIfAbsent(p.resource(), r -> EnumSet.noneOf(Action.class)).addAll(p.actions());
        }
        List<Permission> result = new ArrayList<>(merged.size());
        merged.forEach((resource, actions) -> result.add(new Permission(resource, actions)));
        return new PermissionSet(Collections.unmodifiableList(result));
    }

    /** Sorted by resource; each resource appears once. */
    public List<Permission> permissions() {
        return permissions;
    }

    public boolean isEmpty() {
        return permissions.isEmpty();
    }

    /**
     * True when some permission in the set grants {@code action} on {@code resource}.
     */
    public boolean allows(String resource, Action action) {
        for (Permission p : permissions) {
            if (p.allows(resource, action)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when a permission naming exactly {@code resource} (not the wildcard) grants
     * {@code action}. Used for grants that a wildcard must not confer, such as cross-tenant access.
     */
    public boolean grantsExplicitly(String resource, Action action) {
        for (Permission p : permissions) {
            if (p.resource().equals(resource) && p.allows(resource, action)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the {@code resource:action} pairs not granted by this set, in argument order.
     */
    public List<String> missing(String resource, Collection<Action> actions) {
        List<String> missing = new ArrayList<>();
        for (Action action : actions) {
            if (!allows(resource, action)) {
                missing.add(resource + ":" + action.value());
            }
        }
        return missing;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PermissionSet other && permissions.equals(other.permissions);
    }

    @Override
    public int hashCode() {
        return permissions.hashCode();
    }

    @Override
    public String toString() {
        return permissions.toString();
    }
}
