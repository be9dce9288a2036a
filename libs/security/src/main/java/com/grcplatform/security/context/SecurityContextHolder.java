package com.grcplatform.security.context;

import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;

import java.util.Optional;

/**
 * Thread-local holder for the {@link SecurityContext} of the current request.
 * <p>
 * Set by the authentication filter after a successful authentication and cleared when the
 * request completes.
 */
public final class SecurityContextHolder {

    private static final ThreadLocal<SecurityContext> CURRENT = new ThreadLocal<>();

    private SecurityContextHolder() {
        // utility class
    }

    public static void set(SecurityContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
    }

    public static Optional<SecurityContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Returns the current context.
     *
     * @throws AuthorizationException with {@link AuthErrorCode#AUTHENTICATION_REQUIRED} if unset
     */
    public static SecurityContext require() {
        SecurityContext ctx = CURRENT.get();
        if (ctx == null) {
            throw new AuthorizationException(AuthErrorCode.AUTHENTICATION_REQUIRED);
        }
        return ctx;
    }

    public static void clear() {
        CURRENT.remove();
    }
}
