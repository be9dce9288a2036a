package com.grcplatform.security.quota;

/**
 * Per-tenant usage counters. Implementations must make {@link #tryConsume} atomic with respect
 * to every other call for the same tenant and type.
 */
public interface QuotaStore {

    /** Usage in the current window. */
    long getUsage(String tenantId, QuotaType type);

    /**
     * Adds {@code amount} only if the result stays within {@code limit}.
     */
    QuotaConsumption tryConsume(String tenantId, QuotaType type, long amount, long limit);

    /**
     * Adds {@code amount} unconditionally.
     *
     * @return usage after the addition
     */
    long add(String tenantId, QuotaType type, long amount);
}
