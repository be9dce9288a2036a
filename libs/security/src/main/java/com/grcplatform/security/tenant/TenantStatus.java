package com.grcplatform.security.tenant;

import java.util.Optional;

/**
 * Lifecycle state of a tenant. Only {@link #ACTIVE} tenants may serve requests.
 */
public enum TenantStatus {

    ACTIVE("active"),
    SUSPENDED("suspended"),
    PROVISIONING("provisioning"),
    TERMINATED("terminated"),
    INACTIVE("inactive");

    private final String value;

    TenantStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<TenantStatus> fromString(String value) {
        for (TenantStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
