package com.grcplatform.api.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.grcplatform.observability.CorrelationContext;
import com.grcplatform.observability.CorrelationContextHolder;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import java.time.Instant;
import java.util.Map;

/**
 * Error body returned for every rejected request:
 *
 * <pre>
 * {
 *   "error": {
 *     "code": "TENANT_ACCESS_DENIED",
 *     "message": "User does not have access to the requested tenant",
 *     "timestamp": "2024-06-01T12:00:00Z",
 *     "correlationId": "abc-123"
 *   }
 * }
 * </pre>
 *
 * Server errors carry the generic message and no details.
 */
public record ErrorResponse(Body error) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Body(
            String code,
            String message,
            String timestamp,
            Map<String, Object> details,
            String correlationId) {
    }

    public static ErrorResponse of(AuthorizationException e, Instant now) {
        AuthErrorCode code = e.errorCode();
        boolean serverError = code == AuthErrorCode.INTERNAL_ERROR;
        String message = serverError || e.getMessage() == null ? code.defaultMessage() : e.getMessage();
        Map<String, Object> details = serverError || e.details().isEmpty() ? null : e.details();
        return of(code, message, details, now);
    }

    public static ErrorResponse of(AuthErrorCode code, String message, Map<String, Object> details, Instant now) {
        String correlationId = CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null);
        return new ErrorResponse(new Body(code.code(), message, now.toString(), details, correlationId));
    }
}
