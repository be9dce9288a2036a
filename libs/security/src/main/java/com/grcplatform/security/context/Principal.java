package com.grcplatform.security.context;

import com.grcplatform.security.permission.Action;
import com.grcplatform.security.permission.PermissionSet;
import com.grcplatform.security.permission.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The authenticated caller of one request. Built per request, never persisted.
 *
 * @param userId          local account id
 * @param providerSubject identity provider subject
 * @param email           email resolved from the token or account
 * @param displayName     display name
 * @param tenantId        the resolved tenant for this request
 * @param roles           roles held in that tenant
 * @param permissions     permissions derived from {@code roles}
 */
public record Principal(
        String userId,
        String providerSubject,
        String email,
        String displayName,
        String tenantId,
        Set<Role> roles,
        PermissionSet permissions) {

    public Principal {
        roles = roles == null || roles.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(roles));
        permissions = permissions == null ? PermissionSet.EMPTY : permissions;
    }

    /** True when some held role implies {@code role}. */
    public boolean hasRole(Role role) {
        for (Role held : roles) {
            if (held.implies(role)) {
                return true;
            }
        }
        return false;
    }

    public boolean can(String resource, Action action) {
        return permissions.allows(resource, action);
    }
}
