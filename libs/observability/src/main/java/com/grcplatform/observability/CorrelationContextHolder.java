package com.grcplatform.observability;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-thread {@link CorrelationContext}, mirrored into the SLF4J MDC so log lines written while
 * a request is handled carry its ids.
 * <p>
 * The context is not inherited by other threads. Audit events capture it when they are created,
 * so the asynchronous audit writer never reads this holder.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CURRENT = new ThreadLocal<>();

    private CorrelationContextHolder() {
    }

    /**
     * @throws IllegalArgumentException if {@code context} is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CURRENT.set(context);
        mdcEntries(context).forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CURRENT.get());
    }

    /** Adds tenant and user once the caller is authenticated; ignored when nothing is bound. */
    public static void bindPrincipal(String tenantId, String userId) {
        get().ifPresent(current -> set(current.withPrincipal(tenantId, userId)));
    }

    public static void clear() {
        CURRENT.remove();
        mdcEntries(null).keySet().forEach(MDC::remove);
    }

    private static Map<String, String> mdcEntries(CorrelationContext ctx) {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(CorrelationContext.MDC_CORRELATION_ID, ctx == null ? null : ctx.correlationId());
        entries.put(CorrelationContext.MDC_TENANT_ID, ctx == null ? null : ctx.tenantId());
        entries.put(CorrelationContext.MDC_USER_ID, ctx == null ? null : ctx.userId());
        entries.put(CorrelationContext.MDC_REQUEST_ID, ctx == null ? null : ctx.requestId());
        entries.put(CorrelationContext.MDC_CLIENT_IP, ctx == null ? null : ctx.clientIp());
        return entries;
    }
}
