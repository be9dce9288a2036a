package com.grcplatform.security.permission;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PermissionDeriver")
class PermissionDeriverTest {

    @Nested
    @DisplayName("role policy")
    class Policy {

        @Test
        @DisplayName("AgentUser may read but not write llm-configs")
        void agentUserLlmConfigs() {
            var perms = PermissionDeriver.derive(Set.of(Role.AGENT_USER));

            assertThat(perms.allows("llm-configs", Action.READ)).isTrue();
            assertThat(perms.allows("llm-configs", Action.WRITE)).isFalse();
            assertThat(perms.allows("agents", Action.WRITE)).isTrue();
            assertThat(perms.allows("agents", Action.DELETE)).isFalse();
        }

        @Test
        @DisplayName("TenantOwner may delete any resource")
        void tenantOwnerDeletesAnything() {
            var perms = PermissionDeriver.derive(Set.of(Role.TENANT_OWNER));

            assertThat(perms.allows("anything", Action.DELETE)).isTrue();
            assertThat(perms.grantsExplicitly(PermissionDeriver.CROSS_TENANT, Action.READ)).isFalse();
        }

        @Test
        @DisplayName("PlatformOwner holds the explicit cross-tenant grant")
        void platformOwnerCrossTenant() {
            var perms = PermissionDeriver.derive(Set.of(Role.PLATFORM_OWNER));

            assertThat(perms.grantsExplicitly(PermissionDeriver.CROSS_TENANT, Action.READ)).isTrue();
        }

        @Test
        @DisplayName("Auditor is read-only")
        void auditorReadOnly() {
            var perms = PermissionDeriver.derive(Set.of(Role.AUDITOR));

            assertThat(perms.allows("audit", Action.READ)).isTrue();
            assertThat(perms.allows("audit", Action.WRITE)).isFalse();
            assertThat(perms.allows("risk-assessments", Action.READ)).isFalse();
        }

        @Test
        @DisplayName("ComplianceOfficer may write compliance and risk assessments")
        void complianceOfficer() {
            var perms = PermissionDeriver.derive(Set.of(Role.COMPLIANCE_OFFICER));

            assertThat(perms.allows("compliance", Action.WRITE)).isTrue();
            assertThat(perms.allows("risk-assessments", Action.WRITE)).isTrue();
            assertThat(perms.allows("reports", Action.WRITE)).isFalse();
        }
    }

    @Test
    @DisplayName("no roles yields the empty set")
    void noRoles() {
        assertThat(PermissionDeriver.derive(Set.of())).isEqualTo(PermissionSet.EMPTY);
        assertThat(PermissionDeriver.derive(null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("derivation is deterministic and independent of role order")
    void deterministic() {
        var a = PermissionDeriver.derive(List.of(Role.AUDITOR, Role.AGENT_USER));
        var b = PermissionDeriver.derive(List.of(Role.AGENT_USER, Role.AUDITOR));

        assertThat(a).isEqualTo(b);
        assertThat(a.permissions()).isEqualTo(b.permissions());
    }

    @Test
    @DisplayName("multiple roles union their grants")
    void union() {
        var perms = PermissionDeriver.derive(Set.of(Role.AUDITOR, Role.AGENT_USER));

        assertThat(perms.allows("compliance", Action.READ)).isTrue();
        assertThat(perms.allows("chat", Action.WRITE)).isTrue();
    }
}
