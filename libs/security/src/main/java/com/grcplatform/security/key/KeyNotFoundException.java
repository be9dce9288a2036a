package com.grcplatform.security.key;

/**
 * Thrown when the key discovery endpoint does not publish a key with the requested id.
 */
public class KeyNotFoundException extends KeyResolutionException {

    private final String keyId;

    public KeyNotFoundException(String keyId) {
        super("No signing key published for kid '%s'".formatted(keyId), null);
        this.keyId = keyId;
    }

    public String keyId() {
        return keyId;
    }
}
