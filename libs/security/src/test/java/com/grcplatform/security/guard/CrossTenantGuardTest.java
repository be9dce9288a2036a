package com.grcplatform.security.guard;

import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.observability.SensitiveDataRedactor;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.audit.AuditLogger;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.permission.Role;
import com.grcplatform.security.testing.TestSecurityContextFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("CrossTenantGuard")
class CrossTenantGuardTest {

    private static final String OWN = TestSecurityContextFactory.DEFAULT_TENANT_ID;
    private static final String FOREIGN = "33333333-3333-4333-8333-333333333333";

    private final AuditLogger audit = mock(AuditLogger.class);
    private final CrossTenantGuard guard = new CrossTenantGuard(audit, new SensitiveDataRedactor());
    private final SecurityContext ctx =
            TestSecurityContextFactory.createWithRoles(Role.TENANT_OWNER);

    @Nested
    @DisplayName("allowed requests")
    class Allowed {

        @Test
        @DisplayName("own tenant id in route and body passes")
        void ownTenant() {
            assertThatCode(() -> guard.check(ctx, Map.of("tenantId", OWN), Map.of("tenant_id", OWN)))
                    .doesNotThrowAnyException();
            verifyNoInteractions(audit);
        }

        @Test
        @DisplayName("comparison ignores case")
        void caseInsensitive() {
            assertThatCode(() -> guard.check(ctx, Map.of(), Map.of("tenantId", OWN.toUpperCase())))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("non-UUID values are ignored")
        void nonUuidIgnored() {
            assertThatCode(() -> guard.check(ctx, Map.of("tenantId", "acme"), Map.of("tenant_id", 42)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("PlatformOwner is exempt")
        void platformOwnerExempt() {
            var owner = TestSecurityContextFactory.createWithRoles(Role.PLATFORM_OWNER);

            assertThatCode(() -> guard.check(owner, Map.of(), Map.of("tenantId", FOREIGN)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("null body and params pass")
        void nothingToScan() {
            assertThatCode(() -> guard.check(ctx, null, null)).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("rejected requests")
    class Rejected {

        @Test
        @DisplayName("foreign tenant in route params is denied")
        void foreignRoute() {
            assertThatThrownBy(() -> guard.check(ctx, Map.of("tenant_id", FOREIGN), null))
                    .isInstanceOf(AuthorizationException.class)
                    .extracting(e -> ((AuthorizationException) e).errorCode())
                    .isEqualTo(AuthErrorCode.CROSS_TENANT_ACCESS_DENIED);
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("foreign tenant nested in the body is denied and audited with a redacted body")
        void foreignNested() {
            Map<String, Object> body = Map.of(
                    "password", "hunter2",
                    "items", List.of(Map.of("meta", Map.of("tenantId", FOREIGN))));

            assertThatThrownBy(() -> guard.check(ctx, Map.of(), body))
                    .isInstanceOf(AuthorizationException.class);

            ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
            verify(audit).record(eq(AuditEventType.CROSS_TENANT_ACCESS_ATTEMPT), eq(ctx.userId()), eq(OWN),
                    details.capture());
            assertThat(details.getValue()).containsEntry("requestedTenants", List.of(FOREIGN));
            assertThat((Map<String, Object>) details.getValue().get("requestBody"))
                    .containsEntry("password", SensitiveDataRedactor.REDACTED);
        }
    }

    @Test
    @DisplayName("extractTenantIds finds ids under both conventional keys")
    void extract() {
        var ids = CrossTenantGuard.extractTenantIds(Map.of("tenantId", OWN),
                Map.of("a", List.of(Map.of("tenant_id", FOREIGN)), "other_id", FOREIGN));

        assertThat(ids).containsExactlyInAnyOrder(OWN, FOREIGN);
    }
}
