package com.grcplatform.auditmodel;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of an audit event. Expected operational outcomes such as a tenant running out of
 * quota are {@link #WARNING}; suspected attacks are {@link #ERROR}.
 */
public enum AuditSeverity {

    INFO("info"),
    WARNING("warning"),
    ERROR("error");

    private final String value;

    AuditSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
