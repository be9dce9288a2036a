package com.grcplatform.security.quota;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link QuotaStore} holding counters in memory, for single-instance deployments and tests.
 * <p>
 * Each (tenant, type) counter remembers the window it was last written in; the first update in a
 * new window starts again from zero. Updates run inside {@link ConcurrentMap#compute}, which makes
 * check-and-increment atomic per counter.
 */
public class InMemoryQuotaStore implements QuotaStore {

    private record CounterKey(String tenantId, QuotaType type) {
    }

    private record Counter(String window, long value) {
    }

    private final ConcurrentMap<CounterKey, Counter> counters = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ZoneId zone;

    public InMemoryQuotaStore(Clock clock) {
        this(clock, ZoneOffset.UTC);
    }

    public InMemoryQuotaStore(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public long getUsage(String tenantId, QuotaType type) {
        Counter counter = counters.get(new CounterKey(tenantId, type));
        if (counter == null || !counter.window().equals(currentWindow(type))) {
            return 0;
        }
        return counter.value();
    }

    @Override
    public QuotaConsumption tryConsume(String tenantId, QuotaType type, long amount, long limit) {
        requireNonNegative(amount);
        String window = currentWindow(type);
        boolean[] granted = new boolean[1];
        Counter updated = counters.compute(new CounterKey(tenantId, type), (key, existing) -> {
            long current = existing == null || !existing.window().equals(window) ? 0 : existing.value();
            if (current + amount > limit) {
                granted[0] = false;
                return new Counter(window, current);
            }
            granted[0] = true;
            return new Counter(window, current + amount);
        });
        return new QuotaConsumption(granted[0], updated.value());
    }

    @Override
    public long add(String tenantId, QuotaType type, long amount) {
        requireNonNegative(amount);
        String window = currentWindow(type);
        return counters.compute(new CounterKey(tenantId, type), (key, existing) -> {
            long current = existing == null || !existing.window().equals(window) ? 0 : existing.value();
            return new Counter(window, current + amount);
        }).value();
    }

    /** Drops every counter. */
    public void clear() {
        counters.clear();
    }

    private String currentWindow(QuotaType type) {
        return type.window().windowKey(clock.instant(), zone);
    }

    private static void requireNonNegative(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
    }
}
