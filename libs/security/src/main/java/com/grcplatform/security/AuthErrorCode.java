package com.grcplatform.security;

import java.util.Optional;

/**
 * Stable error codes returned to clients when a request is rejected.
 * <p>
 * The code string and HTTP status are part of the public contract; clients branch on them.
 */
public enum AuthErrorCode {

    MISSING_AUTH_TOKEN(401, false, "Authorization token is required"),
    AUTHENTICATION_FAILED(401, true, "Invalid or expired authentication token"),
    AUTHENTICATION_REQUIRED(401, false, "User must be authenticated"),
    MISSING_TENANT_ID(400, false, "X-Tenant-ID header is required"),
    INVALID_TENANT_ID(400, false, "X-Tenant-ID must be a valid UUID"),
    USER_NOT_FOUND(401, false, "User not found in system"),
    TENANT_ACCESS_DENIED(403, false, "User does not have access to the requested tenant"),
    TENANT_INACTIVE(403, false, "Tenant is not active"),
    INSUFFICIENT_PERMISSIONS(403, false, "User does not have required permissions for this operation"),
    RESOURCE_ACCESS_DENIED(403, false, "User does not have access to this resource"),
    MISSING_RESOURCE_ID(400, false, "Resource ID is required"),
    CROSS_TENANT_ACCESS_DENIED(403, false, "Cannot access resources from other tenants"),
    QUOTA_EXCEEDED(429, true, "Tenant quota exceeded"),
    QUOTA_CHECK_FAILED(500, true, "Unable to check tenant quota"),
    BAD_REQUEST(400, false, "Bad request"),
    PAYLOAD_TOO_LARGE(413, false, "Request body is too large"),
    INTERNAL_ERROR(500, true, "An unexpected error occurred");

    private final int httpStatus;
    private final boolean retryable;
    private final String defaultMessage;

    AuthErrorCode(int httpStatus, boolean retryable, String defaultMessage) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
        this.defaultMessage = defaultMessage;
    }

    /** The code string sent to clients, identical to the constant name. */
    public String code() {
        return name();
    }

    public int httpStatus() {
        return httpStatus;
    }

    /** Whether the client may succeed by retrying (after refreshing its token, or later). */
    public boolean retryable() {
        return retryable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public static Optional<AuthErrorCode> fromString(String code) {
        for (AuthErrorCode c : values()) {
            if (c.name().equals(code)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
