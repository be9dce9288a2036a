package com.grcplatform.auditmodel;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates {@link AuditEvent} instances before they enter the audit chain.
 * <p>
 * Returns all errors at once. Events without a tenant are allowed: an authentication failure
 * can happen before any tenant is known.
 */
public final class AuditEventValidator {

    private AuditEventValidator() {
        // utility class
    }

    /**
     * Validates that the required fields of the event are present.
     *
     * @param event the event to validate
     * @return a {@link ValidationResult} with any errors found
     */
    public static ValidationResult validate(AuditEvent event) {
        if (event == null) {
            return ValidationResult.fail(List.of("event must not be null"));
        }
        List<String> errors = new ArrayList<>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (event.eventType() == null) {
            errors.add("eventType must not be null");
        }
        if (event.category() == null) {
            errors.add("category must not be null");
        }
        if (event.severity() == null) {
            errors.add("severity must not be null");
        }
        if (event.outcome() == null) {
            errors.add("outcome must not be null");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (event.eventType() != null
                && event.eventType().category() == AuditCategory.TENANT_ISOLATION
                && isBlank(event.tenantId())) {
            errors.add("tenantId is required for tenant isolation events");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
