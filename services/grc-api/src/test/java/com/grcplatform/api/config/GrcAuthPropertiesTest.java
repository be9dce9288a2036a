package com.grcplatform.api.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

@DisplayName("GrcAuthProperties")
class GrcAuthPropertiesTest {

    private static GrcAuthProperties minimal() {
        return new GrcAuthProperties("https://idp.test/", "grc-api", "https://idp.test/keys",
                null, null, null, null, null, null, null, null, 0, 0, null, null, null);
    }

    @Test
    @DisplayName("fills defaults for optional settings")
    void defaults() {
        var props = minimal();

        assertThat(props.connectTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.readTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(props.auditQueueCapacity()).isEqualTo(10_000);
        assertThat(props.publicPaths()).containsExactly("/api/v1/info", "/actuator");
        assertThat(props.maxRequestBody()).isEqualTo(DataSize.ofMegabytes(1));
        assertThat(props.trustedProxies()).isEmpty();
    }

    @Test
    @DisplayName("derives verifier and key resolver settings")
    void derivedConfigs() {
        var props = new GrcAuthProperties("https://idp.test/", "grc-api", "https://idp.test/keys",
                "RS256", Duration.ofSeconds(30), Duration.ofSeconds(3), null, null,
                Duration.ofMinutes(20), Duration.ZERO, Duration.ofMinutes(1), 50, 0, null, null, null);

        var verifier = props.tokenVerifierConfig();
        assertThat(verifier.issuer()).isEqualTo("https://idp.test/");
        assertThat(verifier.clockSkew()).isEqualTo(Duration.ofSeconds(30));
        assertThat(verifier.keyResolveTimeout()).isEqualTo(Duration.ofSeconds(3));

        var keys = props.keyResolverConfig();
        assertThat(keys.keyTtl()).isEqualTo(Duration.ofMinutes(20));
        assertThat(keys.refreshInterval()).isZero();
        assertThat(keys.maxCachedKeys()).isEqualTo(50);
    }

    @Test
    @DisplayName("public paths match themselves and their sub-paths")
    void publicPaths() {
        var props = new GrcAuthProperties("https://idp.test/", "grc-api", "https://idp.test/keys",
                null, null, null, null, null, null, null, null, 0, 0, List.of("/health"), null, null);

        assertThat(props.isPublicPath("/health")).isTrue();
        assertThat(props.isPublicPath("/health/live")).isTrue();
        assertThat(props.isPublicPath("/healthcheck")).isFalse();
        assertThat(props.isPublicPath("/api/v1/me")).isFalse();
        assertThat(props.isPublicPath(null)).isFalse();
    }

    @Test
    @DisplayName("default public paths do not leak to sibling paths")
    void publicPathBoundary() {
        var props = minimal();

        assertThat(props.isPublicPath("/api/v1/info")).isTrue();
        assertThat(props.isPublicPath("/actuator/health")).isTrue();
        assertThat(props.isPublicPath("/api/v1/information")).isFalse();
        assertThat(props.isPublicPath("/actuatorX")).isFalse();
    }

    @Test
    @DisplayName("only listed proxies are trusted")
    void trustedProxies() {
        var props = new GrcAuthProperties("https://idp.test/", "grc-api", "https://idp.test/keys",
                null, null, null, null, null, null, null, null, 0, 0, null, DataSize.ofKilobytes(8),
                List.of("10.0.0.1"));

        assertThat(props.isTrustedProxy("10.0.0.1")).isTrue();
        assertThat(props.isTrustedProxy("203.0.113.7")).isFalse();
        assertThat(props.isTrustedProxy(null)).isFalse();
        assertThat(props.maxRequestBody().toBytes()).isEqualTo(8192);
    }
}
