package com.grcplatform.security.token;

/**
 * Thrown by {@link TokenVerifier} with the reason the token was rejected.
 */
public class TokenVerificationException extends RuntimeException {

    private final TokenFailure failure;

    public TokenVerificationException(TokenFailure failure, String message) {
        this(failure, message, null);
    }

    public TokenVerificationException(TokenFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public TokenFailure failure() {
        return failure;
    }
}
