package com.grcplatform.security.quota;

import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.audit.AuditLogger;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.tenant.TenantQuota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enforces per-tenant usage limits.
 * <p>
 * API calls are charged as they are checked, in one atomic store operation, so concurrent
 * requests cannot overshoot the daily limit. A charged call is not refunded if the request fails
 * later. Token and storage quotas are only compared; their usage is reported through
 * {@link #recordUsage}.
 */
public class QuotaEnforcer {

    private static final Logger log = LoggerFactory.getLogger(QuotaEnforcer.class);

    private final QuotaStore store;
    private final AuditLogger auditLogger;

    public QuotaEnforcer(QuotaStore store, AuditLogger auditLogger) {
        this.store = store;
        this.auditLogger = auditLogger;
    }

    /**
     * @throws AuthorizationException {@link AuthErrorCode#QUOTA_EXCEEDED} when over the limit,
     *                                {@link AuthErrorCode#QUOTA_CHECK_FAILED} when the limit or
     *                                usage cannot be read
     */
    public void check(SecurityContext ctx, QuotaType type) {
        String tenantId = ctx.tenantId();
        TenantQuota quota = ctx.tenant().quota();
        if (quota == null) {
            log.error("Tenant {} has no quota configured", tenantId);
            throw new AuthorizationException(AuthErrorCode.QUOTA_CHECK_FAILED);
        }
        long limit = type.limitOf(quota);

        boolean exceeded;
        try {
            if (type == QuotaType.API_CALLS) {
                exceeded = !store.tryConsume(tenantId, type, 1, limit).granted();
            } else {
                exceeded = store.getUsage(tenantId, type) >= limit;
            }
        } catch (RuntimeException e) {
            log.error("Quota store failed checking {} for tenant {}", type.value(), tenantId, e);
            throw new AuthorizationException(AuthErrorCode.QUOTA_CHECK_FAILED,
                    AuthErrorCode.QUOTA_CHECK_FAILED.defaultMessage(), e);
        }

        if (exceeded) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("quotaType", type.value());
            details.put("currentUsage", currentUsage(tenantId));
            details.put("limits", limits(quota));
            log.info("Tenant {} exceeded {} quota", tenantId, type.value());
            auditLogger.record(AuditEventType.QUOTA_EXCEEDED, ctx.userId(), tenantId, details);
            throw new AuthorizationException(AuthErrorCode.QUOTA_EXCEEDED, type.exceededMessage(), details);
        }
    }

    /**
     * Adds consumed usage (e.g. LLM tokens after a completion).
     *
     * @return usage after the addition
     */
    public long recordUsage(String tenantId, QuotaType type, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
        return store.add(tenantId, type, amount);
    }

    private Map<String, Object> currentUsage(String tenantId) {
        Map<String, Object> usage = new LinkedHashMap<>();
        try {
            usage.put("apiCalls", store.getUsage(tenantId, QuotaType.API_CALLS));
            usage.put("tokens", store.getUsage(tenantId, QuotaType.TOKENS));
            usage.put("storage", store.getUsage(tenantId, QuotaType.STORAGE));
        } catch (RuntimeException e) {
            log.warn("Could not read full usage for tenant {}: {}", tenantId, e.getMessage());
        }
        return usage;
    }

    private static Map<String, Object> limits(TenantQuota quota) {
        Map<String, Object> limits = new LinkedHashMap<>();
        limits.put("dailyApiCalls", quota.dailyApiCalls());
        limits.put("monthlyTokens", quota.monthlyTokens());
        limits.put("storageGB", quota.storageGb());
        return limits;
    }
}
