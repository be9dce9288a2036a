package com.grcplatform.security.tenant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TenantIds")
class TenantIdsTest {

    @Test
    @DisplayName("accepts UUIDs in any case")
    void acceptsUuids() {
        assertThat(TenantIds.isUuid("3f2504e0-4f89-11d3-9a0c-0305e82c3301")).isTrue();
        assertThat(TenantIds.isUuid("3F2504E0-4F89-11D3-9A0C-0305E82C3301")).isTrue();
    }

    @Test
    @DisplayName("rejects anything else")
    void rejectsOthers() {
        assertThat(TenantIds.isUuid(null)).isFalse();
        assertThat(TenantIds.isUuid("tenant-1")).isFalse();
        assertThat(TenantIds.isUuid("3f2504e04f8911d39a0c0305e82c3301")).isFalse();
        assertThat(TenantIds.isUuid("3f2504e0-4f89-11d3-9a0c-0305e82c3301x")).isFalse();
    }

    @Test
    @DisplayName("sameTenant ignores case")
    void sameTenant() {
        assertThat(TenantIds.sameTenant("ABCDEF00-0000-4000-8000-000000000000",
                "abcdef00-0000-4000-8000-000000000000")).isTrue();
        assertThat(TenantIds.sameTenant(null, "x")).isFalse();
    }
}
