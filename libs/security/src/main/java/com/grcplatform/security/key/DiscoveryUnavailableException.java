package com.grcplatform.security.key;

/**
 * Thrown when the key discovery endpoint cannot be reached, times out or returns an
 * unparseable key set.
 */
public class DiscoveryUnavailableException extends KeyResolutionException {

    public DiscoveryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public DiscoveryUnavailableException(String message) {
        super(message, null);
    }
}
