package com.grcplatform.security.key;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.PublicKey;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Caching {@link KeyResolver} backed by a {@link KeyDiscoveryClient}.
 * <p>
 * A cache miss triggers one fetch of the whole key set; concurrent misses share it. Every key in
 * the response is cached, so a rotation is picked up by the first request that sees the new kid.
 * A kid that is still missing after a fetch is remembered for
 * {@link KeyResolverConfig#unknownKeyRefetchInterval()} and fails fast until then, which keeps
 * tokens with garbage kids from hammering the discovery endpoint.
 * <p>
 * Lifecycle: construct, optionally {@link #start()} the background refresh, {@link #close()} on
 * shutdown. Expiry follows the injected {@link Clock}.
 */
public class JwksKeyResolver implements KeyResolver, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JwksKeyResolver.class);

    private static final String FETCH_KEY = "jwks";

    private final KeyDiscoveryClient client;
    private final KeyResolverConfig config;
    private final Executor fetchExecutor;
    private final Cache<String, PublicKey> keys;
    private final Cache<String, Boolean> unknownKeyIds;
    private final SingleFlight<String, Map<String, PublicKey>> fetches = new SingleFlight<>();

    private ScheduledExecutorService refresher;

    public JwksKeyResolver(KeyDiscoveryClient client, KeyResolverConfig config, Clock clock, Executor fetchExecutor) {
        if (client == null || config == null || clock == null || fetchExecutor == null) {
            throw new IllegalArgumentException("client, config, clock and fetchExecutor are required");
        }
        this.client = client;
        this.config = config;
        this.fetchExecutor = fetchExecutor;
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.keys = Caffeine.newBuilder()
                .expireAfterWrite(config.keyTtl())
                .maximumSize(config.maxCachedKeys())
                .ticker(ticker)
                .build();
        this.unknownKeyIds = Caffeine.newBuilder()
                .expireAfterWrite(config.unknownKeyRefetchInterval())
                .maximumSize(10_000)
                .ticker(ticker)
                .build();
    }

    @Override
    public CompletableFuture<PublicKey> resolve(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            return CompletableFuture.failedFuture(new KeyNotFoundException(keyId));
        }
        PublicKey cached = keys.getIfPresent(keyId);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        if (unknownKeyIds.getIfPresent(keyId) != null) {
            log.debug("kid={} was unknown at the last fetch, not re-fetching yet", keyId);
            return CompletableFuture.failedFuture(new KeyNotFoundException(keyId));
        }
        return fetches.execute(FETCH_KEY, () -> CompletableFuture.supplyAsync(this::fetchAndCache, fetchExecutor))
                .thenApply(fetched -> {
                    PublicKey key = fetched.get(keyId);
                    if (key == null) {
                        unknownKeyIds.put(keyId, Boolean.TRUE);
                        log.warn("kid={} not published by identity provider", keyId);
                        throw new KeyNotFoundException(keyId);
                    }
                    return key;
                });
    }

    private Map<String, PublicKey> fetchAndCache() {
        Map<String, PublicKey> fetched = client.fetchKeys();
        keys.putAll(fetched);
        unknownKeyIds.invalidateAll(fetched.keySet());
        log.info("Signing key set refreshed: {} keys", fetched.size());
        return fetched;
    }

    /**
     * Starts the background refresh, if a refresh interval is configured.
     */
    public synchronized void start() {
        if (refresher != null || config.refreshInterval().isZero()) {
            return;
        }
        refresher = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "jwks-refresh");
            t.setDaemon(true);
            return t;
        });
        long periodMs = config.refreshInterval().toMillis();
        refresher.scheduleWithFixedDelay(this::refresh, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Re-fetches the key set now. Failures are logged and the cached keys stay in place.
     */
    public void refresh() {
        try {
            fetches.execute(FETCH_KEY, () -> CompletableFuture.completedFuture(fetchAndCache())).join();
        } catch (RuntimeException e) {
            log.warn("Background key refresh failed, keeping cached keys: {}", e.getMessage());
        }
    }

    /** Drops every cached and negatively cached key. */
    public void clear() {
        keys.invalidateAll();
        unknownKeyIds.invalidateAll();
    }

    /** Number of keys currently cached. */
    public long cachedKeyCount() {
        keys.cleanUp();
        return keys.estimatedSize();
    }

    @Override
    public synchronized void close() {
        if (refresher != null) {
            refresher.shutdownNow();
            refresher = null;
        }
    }
}
