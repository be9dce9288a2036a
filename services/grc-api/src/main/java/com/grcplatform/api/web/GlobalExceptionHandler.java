package com.grcplatform.api.web;

import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions raised by guards and controllers to {@link ErrorResponse} bodies.
 *
 * <p>Unexpected failures are logged with their stack trace and answered with the generic
 * {@code INTERNAL_ERROR} body.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(AuthorizationException ex) {
        if (ex.errorCode().httpStatus() >= 500) {
            log.error("Authorization check failed: {}", ex.errorCode(), ex);
        } else {
            log.info("Request denied: {} {}", ex.errorCode(), ex.getMessage());
        }
        return ResponseEntity.status(ex.httpStatus()).body(ErrorResponse.of(ex, clock.instant()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return badRequest(detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return badRequest("Request body is not valid JSON");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        AuthErrorCode code = AuthErrorCode.INTERNAL_ERROR;
        return ResponseEntity.status(code.httpStatus())
                .body(ErrorResponse.of(code, code.defaultMessage(), null, clock.instant()));
    }

    private ResponseEntity<ErrorResponse> badRequest(String message) {
        AuthErrorCode code = AuthErrorCode.BAD_REQUEST;
        return ResponseEntity.status(code.httpStatus()).body(ErrorResponse.of(code, message, null, clock.instant()));
    }
}
