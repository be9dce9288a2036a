package com.grcplatform.api.config;

import com.grcplatform.security.key.KeyResolverConfig;
import com.grcplatform.security.token.TokenVerifierConfig;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

/**
 * Identity provider and authorization settings, bound from {@code grc.auth.*}.
 *
 * <pre>
 * grc:
 *   auth:
 *     issuer: https://login.example.com/tenant-id/v2.0/
 *     audience: api://grc-api
 *     jwks-uri: https://login.example.com/tenant-id/discovery/v2.0/keys
 *     clock-skew: 0s
 *     key-ttl: 10m
 *     refresh-interval: 5m
 * </pre>
 *
 * @param issuer                    expected {@code iss} claim
 * @param audience                  expected {@code aud} value
 * @param jwksUri                   key discovery endpoint
 * @param algorithm                 accepted JWS algorithm, default RS256
 * @param clockSkew                 tolerance on {@code exp}/{@code nbf}, default zero
 * @param keyResolveTimeout         upper bound on waiting for a signing key, default 30s
 * @param connectTimeout            key discovery connect timeout, default 5s
 * @param readTimeout               key discovery read timeout, default 10s
 * @param keyTtl                    cached key lifetime, default 10m
 * @param refreshInterval           background key refresh period, default 5m, zero disables
 * @param unknownKeyRefetchInterval minimum gap between re-fetches for an unpublished kid, default 30s
 * @param maxCachedKeys             key cache bound, default 100
 * @param auditQueueCapacity        pending audit records before new ones are dropped, default 10000
 * @param publicPaths               paths served without authentication, each matching itself and
 *                                  everything below it
 * @param maxRequestBody            largest JSON body buffered for inspection, default 1MB
 * @param trustedProxies            proxy addresses whose {@code X-Forwarded-For} is believed, default none
 */
@ConfigurationProperties(prefix = "grc.auth")
@Validated
public record GrcAuthProperties(
        @NotBlank String issuer,
        @NotBlank String audience,
        @NotBlank String jwksUri,
        String algorithm,
        Duration clockSkew,
        Duration keyResolveTimeout,
        Duration connectTimeout,
        Duration readTimeout,
        Duration keyTtl,
        Duration refreshInterval,
        Duration unknownKeyRefetchInterval,
        long maxCachedKeys,
        int auditQueueCapacity,
        List<String> publicPaths,
        DataSize maxRequestBody,
        List<String> trustedProxies) {

    public GrcAuthProperties {
        if (connectTimeout == null) {
            connectTimeout = Duration.ofSeconds(5);
        }
        if (readTimeout == null) {
            readTimeout = Duration.ofSeconds(10);
        }
        if (auditQueueCapacity <= 0) {
            auditQueueCapacity = 10_000;
        }
        if (publicPaths == null || publicPaths.isEmpty()) {
            publicPaths = List.of("/api/v1/info", "/actuator");
        } else {
            publicPaths = List.copyOf(publicPaths);
        }
        if (maxRequestBody == null || maxRequestBody.isNegative()) {
            maxRequestBody = DataSize.ofMegabytes(1);
        }
        trustedProxies = trustedProxies == null ? List.of() : List.copyOf(trustedProxies);
    }

    public TokenVerifierConfig tokenVerifierConfig() {
        return new TokenVerifierConfig(issuer, audience, algorithm, clockSkew, keyResolveTimeout);
    }

    public KeyResolverConfig keyResolverConfig() {
        return new KeyResolverConfig(keyTtl, refreshInterval, unknownKeyRefetchInterval, maxCachedKeys);
    }

    public boolean isPublicPath(String path) {
        return path != null && publicPaths.stream()
                .anyMatch(p -> path.equals(p) || path.startsWith(p.endsWith("/") ? p : p + "/"));
    }

    public boolean isTrustedProxy(String address) {
        return address != null && trustedProxies.contains(address.strip());
    }
}
