package com.grcplatform.security.permission;

import java.util.Optional;

/**
 * Platform roles. A user holds one or more roles per tenant.
 * <p>
 * {@link #PLATFORM_OWNER} is the super-role: it implies every other role, so any role
 * requirement is satisfied by it.
 */
public enum Role {

    PLATFORM_OWNER("PlatformOwner"),
    TENANT_OWNER("TenantOwner"),
    AGENT_USER("AgentUser"),
    AUDITOR("Auditor"),
    COMPLIANCE_OFFICER("ComplianceOfficer");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "TenantOwner"). */
    public String value() {
        return value;
    }

    /**
     * Checks whether holding this role satisfies a requirement for {@code other}.
     */
    public boolean implies(Role other) {
        return this == other || this == PLATFORM_OWNER;
    }

    /**
     * Looks up a Role by its canonical string value (e.g., "AgentUser").
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
