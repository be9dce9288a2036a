package com.grcplatform.security.token;

import java.time.Duration;

/**
 * Expectations a token must meet.
 *
 * @param issuer             required {@code iss}
 * @param audience           value that must appear in {@code aud}
 * @param algorithm          the only accepted JWS algorithm, default RS256
 * @param clockSkew          tolerance applied to {@code exp} and {@code nbf}, default zero
 * @param keyResolveTimeout  upper bound on waiting for a signing key, default 30 seconds
 */
public record TokenVerifierConfig(
        String issuer,
        String audience,
        String algorithm,
        Duration clockSkew,
        Duration keyResolveTimeout) {

    public TokenVerifierConfig {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("issuer must not be blank");
        }
        if (audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("audience must not be blank");
        }
        if (algorithm == null || algorithm.isBlank()) algorithm = "RS256";
        if (clockSkew == null) clockSkew = Duration.ZERO;
        if (keyResolveTimeout == null) keyResolveTimeout = Duration.ofSeconds(30);
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be negative");
        }
    }

    public static TokenVerifierConfig of(String issuer, String audience) {
        return new TokenVerifierConfig(issuer, audience, null, null, null);
    }
}
