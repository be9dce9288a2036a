package com.grcplatform.auditmodel;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * All security-relevant decisions the authorization core records.
 * <p>
 * Each type carries its category, default severity and outcome so call sites only name the
 * event. The {@code value} is the canonical string stored in the audit trail.
 */
public enum AuditEventType {

    // ---- Authentication ----
    AUTHENTICATION_SUCCESS("authentication_success",
            AuditCategory.AUTHENTICATION, AuditSeverity.INFO, AuditOutcome.SUCCESS),
    AUTHENTICATION_FAILURE("authentication_failure",
            AuditCategory.AUTHENTICATION, AuditSeverity.ERROR, AuditOutcome.FAILURE),

    // ---- Authorization ----
    AUTHORIZATION_FAILURE("authorization_failure",
            AuditCategory.AUTHORIZATION, AuditSeverity.ERROR, AuditOutcome.DENIED),
    UNAUTHORIZED_RESOURCE_ACCESS("unauthorized_resource_access",
            AuditCategory.AUTHORIZATION, AuditSeverity.ERROR, AuditOutcome.DENIED),

    // ---- Tenant isolation ----
    UNAUTHORIZED_TENANT_ACCESS("unauthorized_tenant_access",
            AuditCategory.TENANT_ISOLATION, AuditSeverity.ERROR, AuditOutcome.DENIED),
    CROSS_TENANT_ACCESS_ATTEMPT("cross_tenant_access_attempt",
            AuditCategory.TENANT_ISOLATION, AuditSeverity.ERROR, AuditOutcome.DENIED),

    // ---- Usage ----
    QUOTA_EXCEEDED("quota_exceeded",
            AuditCategory.USAGE, AuditSeverity.WARNING, AuditOutcome.DENIED);

    private final String value;
    private final AuditCategory category;
    private final AuditSeverity severity;
    private final AuditOutcome outcome;

    AuditEventType(String value, AuditCategory category, AuditSeverity severity, AuditOutcome outcome) {
        this.value = value;
        this.category = category;
        this.severity = severity;
        this.outcome = outcome;
    }

    /** The canonical string representation used in JSON (e.g. "quota_exceeded"). */
    @JsonValue
    public String value() {
        return value;
    }

    public AuditCategory category() {
        return category;
    }

    public AuditSeverity severity() {
        return severity;
    }

    public AuditOutcome outcome() {
        return outcome;
    }

    /**
     * Looks up an event type by its canonical string value.
     *
     * @param value the string to match (e.g. "authorization_failure")
     * @return the matching type, or empty if not found
     */
    public static Optional<AuditEventType> fromString(String value) {
        for (AuditEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
