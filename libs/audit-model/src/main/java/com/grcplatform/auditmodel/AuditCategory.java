package com.grcplatform.auditmodel;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse grouping of audit events, used for retention and reporting filters.
 */
public enum AuditCategory {

    AUTHENTICATION("authentication"),
    AUTHORIZATION("authorization"),
    TENANT_ISOLATION("tenant_isolation"),
    USAGE("usage");

    private final String value;

    AuditCategory(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON. */
    @JsonValue
    public String value() {
        return value;
    }
}
