package com.grcplatform.security.permission;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.grcplatform.security.permission.Action.DELETE;
import static com.grcplatform.security.permission.Action.READ;
import static com.grcplatform.security.permission.Action.WRITE;

/**
 * Derives a {@link PermissionSet} from a user's roles using the fixed role policy table.
 * <p>
 * Pure function of its input: no I/O and no shared mutable state.
 */
public final class PermissionDeriver {

    /** Resource type guarding access to other tenants' data. */
    public static final String CROSS_TENANT = "cross-tenant";

    private static final Map<Role, List<Permission>> POLICY = buildPolicy();

    private PermissionDeriver() {
        // utility class
    }

    private static Map<Role, List<Permission>> buildPolicy() {
        Map<Role, List<Permission>> table = new EnumMap<>(Role.class);
        table.put(Role.PLATFORM_OWNER, List.of(
                Permission.all(Permission.ANY_RESOURCE),
                Permission.all(CROSS_TENANT),
                Permission.all("mcp-registry"),
                Permission.all("platform-settings")));
        table.put(Role.TENANT_OWNER, List.of(
                Permission.all(Permission.ANY_RESOURCE),
                Permission.of("users", READ, WRITE, DELETE),
                Permission.of("tenant-settings", READ, WRITE),
                Permission.of("audit", READ),
                Permission.of("billing", READ)));
        table.put(Role.AGENT_USER, List.of(
                Permission.of("dashboard", READ),
                Permission.of("agents", READ, WRITE),
                Permission.of("mcp-tools", READ, WRITE),
                Permission.of("chat", READ, WRITE),
                Permission.of("llm-configs", READ),
                Permission.of("connections", READ)));
        table.put(Role.AUDITOR, List.of(
                Permission.of("audit", READ),
                Permission.of("compliance", READ),
                Permission.of("reports", READ),
                Permission.of("dashboard", READ)));
        table.put(Role.COMPLIANCE_OFFICER, List.of(
                Permission.of("audit", READ),
                Permission.of("compliance", READ, WRITE),
                Permission.of("reports", READ),
                Permission.of("dashboard", READ),
                Permission.of("risk-assessments", READ, WRITE)));
        return Collections.unmodifiableMap(table);
    }

    /**
     * Returns the union of the permissions of every role.
     */
    public static PermissionSet derive(Collection<Role> roles) {
        if (roles == null || roles.isEmpty()) {
            return PermissionSet.EMPTY;
        }
        List<Permission> all = new ArrayList<>();
        for (Role role : roles) {
            all.addAll(POLICY.getOrDefault(role, List.of()));
        }
        return PermissionSet.of(all);
    }

    /** The permissions granted by a single role. */
    public static List<Permission> permissionsOf(Role role) {
        return POLICY.getOrDefault(role, List.of());
    }
}
