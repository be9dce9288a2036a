package com.grcplatform.auditmodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable record of one security-relevant decision.
 * <p>
 * Audit events are write-once: the authorization core creates them, chains them into the
 * tamper-evident trail and never mutates or deletes them. {@code details} is copied defensively
 * and may be empty but never null.
 *
 * @param eventId       unique identifier of this event (UUID)
 * @param eventType     what happened
 * @param category      coarse grouping, normally {@code eventType.category()}
 * @param severity      severity, normally {@code eventType.severity()}
 * @param outcome       decision result, normally {@code eventType.outcome()}
 * @param occurredAt    when the decision was taken
 * @param userId        local user id of the caller, when known
 * @param tenantId      tenant the request targeted, when known
 * @param correlationId correlation id of the request that triggered the event
 * @param clientIp      remote address of the caller
 * @param userAgent     user agent of the caller
 * @param details       event-specific context (required vs. held roles, quota usage, ...)
 */
public record AuditEvent(
        String eventId,
        AuditEventType eventType,
        AuditCategory category,
        AuditSeverity severity,
        AuditOutcome outcome,
        Instant occurredAt,
        String userId,
        String tenantId,
        String correlationId,
        String clientIp,
        String userAgent,
        Map<String, Object> details) {

    public AuditEvent {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
