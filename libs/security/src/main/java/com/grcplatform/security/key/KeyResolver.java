package com.grcplatform.security.key;

import java.security.PublicKey;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves the public key for a token's key id.
 */
public interface KeyResolver {

    /**
     * Resolves a key asynchronously. The future fails with {@link KeyNotFoundException} or
     * {@link DiscoveryUnavailableException}.
     */
    CompletableFuture<PublicKey> resolve(String keyId);

    /**
     * Resolves a key, waiting at most {@code timeout}. An expired wait cancels only this
     * caller's future.
     *
     * @throws KeyNotFoundException          if no key with that id is published
     * @throws DiscoveryUnavailableException if discovery fails or the wait times out
     */
    default PublicKey resolve(String keyId, Duration timeout) {
        CompletableFuture<PublicKey> future = resolve(keyId);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof KeyResolutionException kre) {
                throw kre;
            }
            throw new DiscoveryUnavailableException("Key resolution failed for kid " + keyId, e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DiscoveryUnavailableException("Key resolution timed out after " + timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DiscoveryUnavailableException("Interrupted while resolving kid " + keyId, e);
        }
    }
}
