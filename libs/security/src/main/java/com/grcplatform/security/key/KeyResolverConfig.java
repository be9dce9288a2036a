package com.grcplatform.security.key;

import java.time.Duration;

/**
 * Tuning for {@link JwksKeyResolver}.
 *
 * @param keyTtl                    how long a fetched key is trusted without re-fetching
 * @param refreshInterval           background refresh period; zero disables the refresh
 * @param unknownKeyRefetchInterval minimum gap between re-fetches triggered by the same unknown kid
 * @param maxCachedKeys             upper bound on cached keys
 */
public record KeyResolverConfig(
        Duration keyTtl,
        Duration refreshInterval,
        Duration unknownKeyRefetchInterval,
        long maxCachedKeys) {

    public KeyResolverConfig {
        if (keyTtl == null) keyTtl = Duration.ofMinutes(10);
        if (refreshInterval == null) refreshInterval = Duration.ofMinutes(5);
        if (unknownKeyRefetchInterval == null) unknownKeyRefetchInterval = Duration.ofSeconds(30);
        if (maxCachedKeys <= 0) maxCachedKeys = 100;
        if (keyTtl.isNegative() || keyTtl.isZero()) {
            throw new IllegalArgumentException("keyTtl must be positive");
        }
        if (refreshInterval.isNegative()) {
            throw new IllegalArgumentException("refreshInterval must not be negative");
        }
    }

    public static KeyResolverConfig defaults() {
        return new KeyResolverConfig(null, null, null, 0);
    }
}
