package com.grcplatform.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a request is rejected by any stage of the authorization core.
 * <p>
 * Carries the stable {@link AuthErrorCode} and optional client-safe details. The message is
 * client-facing; internal causes are attached as the exception cause and only logged.
 */
public class AuthorizationException extends RuntimeException {

    private final AuthErrorCode errorCode;
    private final Map<String, Object> details;

    public AuthorizationException(AuthErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage(), Map.of(), null);
    }

    public AuthorizationException(AuthErrorCode errorCode, String message) {
        this(errorCode, message, Map.of(), null);
    }

    public AuthorizationException(AuthErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    public AuthorizationException(AuthErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, Map.of(), cause);
    }

    public AuthorizationException(
            AuthErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public AuthErrorCode errorCode() {
        return errorCode;
    }

    public int httpStatus() {
        return errorCode.httpStatus();
    }

    /** Client-safe details; empty when there are none. */
    public Map<String, Object> details() {
        return details;
    }
}
