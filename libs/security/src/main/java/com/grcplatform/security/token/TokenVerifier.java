package com.grcplatform.security.token;

import com.grcplatform.security.key.DiscoveryUnavailableException;
import com.grcplatform.security.key.KeyNotFoundException;
import com.grcplatform.security.key.KeyResolver;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.factories.DefaultJWSVerifierFactory;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.security.PublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Verifies signed bearer tokens against keys from a {@link KeyResolver}.
 * <p>
 * Checks run in a fixed order and stop at the first failure: parse, algorithm, key id, key
 * resolution, signature, audience, issuer, expiry, not-before. Only the configured algorithm is
 * accepted, so a token cannot downgrade to {@code none} or to an HMAC keyed with the public key.
 * <p>
 * Thread-safe; apart from key resolution the verifier does no I/O.
 */
public class TokenVerifier {

    private final KeyResolver keyResolver;
    private final TokenVerifierConfig config;
    private final JWSAlgorithm algorithm;
    private final Clock clock;
    private final DefaultJWSVerifierFactory verifierFactory = new DefaultJWSVerifierFactory();

    public TokenVerifier(KeyResolver keyResolver, TokenVerifierConfig config, Clock clock) {
        this.keyResolver = keyResolver;
        this.config = config;
        this.algorithm = JWSAlgorithm.parse(config.algorithm());
        this.clock = clock;
    }

    /**
     * Verifies a token and returns its claims.
     *
     * @throws TokenVerificationException naming the first check that failed
     */
    public ClaimSet verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenVerificationException(TokenFailure.MISSING_TOKEN, "Token is missing");
        }

        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new TokenVerificationException(TokenFailure.MALFORMED_TOKEN, "Token is not a signed JWT", e);
        }

        JWSHeader header = jwt.getHeader();
        if (!algorithm.equals(header.getAlgorithm())) {
            throw new TokenVerificationException(TokenFailure.UNSUPPORTED_ALGORITHM,
                    "Token algorithm " + header.getAlgorithm() + " is not accepted");
        }
        String keyId = header.getKeyID();
        if (keyId == null || keyId.isBlank()) {
            throw new TokenVerificationException(TokenFailure.MALFORMED_TOKEN, "Token header has no kid");
        }

        PublicKey key;
        try {
            key = keyResolver.resolve(keyId, config.keyResolveTimeout());
        } catch (KeyNotFoundException e) {
            throw new TokenVerificationException(TokenFailure.UNKNOWN_SIGNING_KEY,
                    "No signing key for kid " + keyId, e);
        } catch (DiscoveryUnavailableException e) {
            throw new TokenVerificationException(TokenFailure.KEY_DISCOVERY_UNAVAILABLE,
                    "Signing keys are unavailable", e);
        }

        try {
            JWSVerifier verifier = verifierFactory.createJWSVerifier(header, key);
            if (!jwt.verify(verifier)) {
                throw new TokenVerificationException(TokenFailure.SIGNATURE_INVALID, "Token signature is invalid");
            }
        } catch (JOSEException e) {
            throw new TokenVerificationException(TokenFailure.SIGNATURE_INVALID,
                    "Token signature could not be verified", e);
        }

        JWTClaimsSet claims;
        try {
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new TokenVerificationException(TokenFailure.MALFORMED_TOKEN, "Token payload is not valid JSON", e);
        }

        List<String> audience = claims.getAudience();
        if (audience == null || !audience.contains(config.audience())) {
            throw new TokenVerificationException(TokenFailure.AUDIENCE_MISMATCH, "Token audience does not match");
        }
        if (!config.issuer().equals(claims.getIssuer())) {
            throw new TokenVerificationException(TokenFailure.ISSUER_MISMATCH, "Token issuer does not match");
        }

        Instant now = clock.instant();
        Instant expiresAt = toInstant(claims.getExpirationTime());
        if (expiresAt == null || !now.isBefore(expiresAt.plus(config.clockSkew()))) {
            throw new TokenVerificationException(TokenFailure.EXPIRED, "Token has expired");
        }
        Instant notBefore = toInstant(claims.getNotBeforeTime());
        if (notBefore != null && now.plus(config.clockSkew()).isBefore(notBefore)) {
            throw new TokenVerificationException(TokenFailure.NOT_YET_VALID, "Token is not valid yet");
        }

        return new ClaimSet(
                claims.getSubject(),
                claims.getIssuer(),
                audience,
                expiresAt,
                toInstant(claims.getIssueTime()),
                notBefore,
                claims.getClaims());
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
