package com.grcplatform.security.token;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verified token payload.
 *
 * @param subject   {@code sub}
 * @param issuer    {@code iss}
 * @param audience  {@code aud}, never null
 * @param expiresAt {@code exp}
 * @param issuedAt  {@code iat}, may be null
 * @param notBefore {@code nbf}, may be null
 * @param claims    every claim in the payload, including the registered ones
 */
public record ClaimSet(
        String subject,
        String issuer,
        List<String> audience,
        Instant expiresAt,
        Instant issuedAt,
        Instant notBefore,
        Map<String, Object> claims) {

    public ClaimSet {
        audience = audience == null ? List.of() : List.copyOf(audience);
        claims = claims == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    public Optional<Object> claim(String name) {
        return Optional.ofNullable(claims.get(name));
    }

    public Optional<String> stringClaim(String name) {
        Object value = claims.get(name);
        if (value instanceof String s && !s.isBlank()) {
            return Optional.of(s);
        }
        return Optional.empty();
    }

    /**
     * Email address: {@code email}, else the first of {@code emails}, else
     * {@code preferred_username}.
     */
    public Optional<String> email() {
        Optional<String> email = stringClaim("email");
        if (email.isPresent()) {
            return email;
        }
        if (claims.get("emails") instanceof List<?> emails && !emails.isEmpty()
                && emails.get(0) instanceof String first && !first.isBlank()) {
            return Optional.of(first);
        }
        return stringClaim("preferred_username");
    }

    /**
     * Display name: {@code name}, else {@code given_name} and {@code family_name} joined.
     */
    public Optional<String> displayName() {
        Optional<String> name = stringClaim("name");
        if (name.isPresent()) {
            return name;
        }
        String joined = (stringClaim("given_name").orElse("") + " "
                + stringClaim("family_name").orElse("")).strip();
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
    }

    /**
     * Stable user object id at the identity provider: {@code oid}, else {@code sub}.
     */
    public String objectId() {
        return stringClaim("oid").orElse(subject);
    }
}
