package com.grcplatform.auditmodel;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AuditEventValidator")
class AuditEventValidatorTest {

    private static AuditEvent event(String id, AuditEventType type, Instant at, String tenantId) {
        return new AuditEvent(id, type,
                type == null ? null : type.category(),
                type == null ? null : type.severity(),
                type == null ? null : type.outcome(),
                at, "u-1", tenantId, "corr", "127.0.0.1", "ua", Map.of());
    }

    @Test
    @DisplayName("complete event passes")
    void completeEventPasses() {
        var result = AuditEventValidator.validate(
                event("e-1", AuditEventType.AUTHORIZATION_FAILURE, Instant.now(), "t-1"));

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("authentication failure without tenant passes")
    void authFailureWithoutTenant() {
        var result = AuditEventValidator.validate(
                event("e-1", AuditEventType.AUTHENTICATION_FAILURE, Instant.now(), null));

        assertThat(result.valid()).isTrue();
    }

    @Nested
    @DisplayName("invalid events")
    class Invalid {

        @Test
        @DisplayName("null event fails")
        void nullEvent() {
            assertThat(AuditEventValidator.validate(null).valid()).isFalse();
        }

        @Test
        @DisplayName("reports every missing field at once")
        void reportsAllErrors() {
            var result = AuditEventValidator.validate(event(" ", null, null, null));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors())
                    .anyMatch(e -> e.contains("eventId"))
                    .anyMatch(e -> e.contains("eventType"))
                    .anyMatch(e -> e.contains("occurredAt"));
        }

        @Test
        @DisplayName("tenant isolation event requires a tenant")
        void tenantIsolationNeedsTenant() {
            var result = AuditEventValidator.validate(
                    event("e-1", AuditEventType.CROSS_TENANT_ACCESS_ATTEMPT, Instant.now(), ""));

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).anyMatch(e -> e.contains("tenantId"));
        }
    }
}
