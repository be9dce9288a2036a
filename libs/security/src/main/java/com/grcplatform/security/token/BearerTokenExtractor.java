package com.grcplatform.security.token;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts bearer tokens from HTTP Authorization headers.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "bearer ";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the token from a {@code "Bearer <token>"} header value. The scheme is matched
     * case-insensitively and must be followed by whitespace.
     *
     * @param authorizationHeader the full Authorization header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        if (token.isEmpty() || token.indexOf(' ') >= 0) {
            return Optional.empty();
        }
        return Optional.of(token);
    }
}
