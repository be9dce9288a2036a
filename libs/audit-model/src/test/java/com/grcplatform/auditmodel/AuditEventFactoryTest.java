package com.grcplatform.auditmodel;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuditEventFactory")
class AuditEventFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final AuditEventFactory.RequestOrigin ORIGIN =
            new AuditEventFactory.RequestOrigin("corr-1", "10.0.0.7", "curl/8.4");

    @Nested
    @DisplayName("defaults from event type")
    class Defaults {

        @Test
        @DisplayName("quota_exceeded is a warning with a denied outcome")
        void quotaExceededIsWarning() {
            AuditEvent event = AuditEventFactory.create(
                    AuditEventType.QUOTA_EXCEEDED, "u-1", "t-1", Map.of(), ORIGIN, CLOCK);

            assertThat(event.severity()).isEqualTo(AuditSeverity.WARNING);
            assertThat(event.outcome()).isEqualTo(AuditOutcome.DENIED);
            assertThat(event.category()).isEqualTo(AuditCategory.USAGE);
        }

        @Test
        @DisplayName("cross-tenant attempt is an error in the tenant isolation category")
        void crossTenantIsError() {
            AuditEvent event = AuditEventFactory.create(
                    AuditEventType.CROSS_TENANT_ACCESS_ATTEMPT, "u-1", "t-1", Map.of(), ORIGIN, CLOCK);

            assertThat(event.severity()).isEqualTo(AuditSeverity.ERROR);
            assertThat(event.category()).isEqualTo(AuditCategory.TENANT_ISOLATION);
        }
    }

    @Test
    @DisplayName("stamps time from the clock and copies request origin")
    void stampsTimeAndOrigin() {
        AuditEvent event = AuditEventFactory.create(
                AuditEventType.AUTHENTICATION_SUCCESS, "u-1", "t-1", null, ORIGIN, CLOCK);

        assertThat(event.occurredAt()).isEqualTo(NOW);
        assertThat(event.correlationId()).isEqualTo("corr-1");
        assertThat(event.clientIp()).isEqualTo("10.0.0.7");
        assertThat(event.userAgent()).isEqualTo("curl/8.4");
        assertThat(event.details()).isEmpty();
    }

    @Test
    @DisplayName("null origin leaves request fields empty")
    void nullOrigin() {
        AuditEvent event = AuditEventFactory.create(
                AuditEventType.AUTHENTICATION_FAILURE, null, null, Map.of(), null, CLOCK);

        assertThat(event.correlationId()).isNull();
        assertThat(event.clientIp()).isNull();
    }

    @Test
    @DisplayName("every event gets a distinct id")
    void distinctIds() {
        AuditEvent a = AuditEventFactory.create(
                AuditEventType.AUTHENTICATION_SUCCESS, "u", "t", Map.of(), ORIGIN, CLOCK);
        AuditEvent b = AuditEventFactory.create(
                AuditEventType.AUTHENTICATION_SUCCESS, "u", "t", Map.of(), ORIGIN, CLOCK);

        assertThat(a.eventId()).isNotEqualTo(b.eventId());
    }

    @Test
    @DisplayName("details are copied and cannot be changed afterwards")
    void detailsAreImmutable() {
        Map<String, Object> details = new HashMap<>();
        details.put("requiredRoles", "TenantAdmin");

        AuditEvent event = AuditEventFactory.create(
                AuditEventType.AUTHORIZATION_FAILURE, "u", "t", details, ORIGIN, CLOCK);
        details.put("later", "x");

        assertThat(event.details()).containsOnlyKeys("requiredRoles");
    }
}
