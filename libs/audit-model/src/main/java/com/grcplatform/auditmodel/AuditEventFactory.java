package com.grcplatform.auditmodel;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Factory methods for {@link AuditEvent} instances.
 * <p>
 * Derives category, severity and outcome from the event type, generates the event id and stamps
 * the time from the supplied clock.
 */
public final class AuditEventFactory {

    private AuditEventFactory() {
        // utility class
    }

    /**
     * Origin of the request that caused an audit event.
     *
     * @param correlationId correlation id of the request
     * @param clientIp      remote address
     * @param userAgent     user agent header
     */
    public record RequestOrigin(String correlationId, String clientIp, String userAgent) {

        /** Origin for events raised outside any request. */
        public static RequestOrigin unknown() {
            return new RequestOrigin(null, null, null);
        }
    }

    /**
     * Creates an event with the type's default category, severity and outcome.
     */
    public static AuditEvent create(
            AuditEventType type,
            String userId,
            String tenantId,
            Map<String, Object> details,
            RequestOrigin origin,
            Clock clock
    ) {
        return create(type, type.severity(), userId, tenantId, details, origin, clock.instant());
    }

    /**
     * Creates an event with an explicit severity and timestamp.
     */
    public static AuditEvent create(
            AuditEventType type,
            AuditSeverity severity,
            String userId,
            String tenantId,
            Map<String, Object> details,
            RequestOrigin origin,
            Instant occurredAt
    ) {
        RequestOrigin o = origin == null ? RequestOrigin.unknown() : origin;
        return new AuditEvent(
                UUID.randomUUID().toString(),
                type,
                type.category(),
                severity,
                type.outcome(),
                occurredAt,
                userId,
                tenantId,
                o.correlationId(),
                o.clientIp(),
                o.userAgent(),
                details
        );
    }
}
