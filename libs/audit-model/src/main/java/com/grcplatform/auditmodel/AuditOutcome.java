package com.grcplatform.auditmodel;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result of the security decision being audited.
 */
public enum AuditOutcome {

    SUCCESS("success"),
    DENIED("denied"),
    FAILURE("failure");

    private final String value;

    AuditOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
