package com.grcplatform.security.key;

/**
 * Base type for failures resolving a signing key.
 */
public abstract class KeyResolutionException extends RuntimeException {

    protected KeyResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
