package com.grcplatform.api.api;

import com.grcplatform.api.web.guard.EnforceQuota;
import com.grcplatform.api.web.guard.PreventCrossTenantAccess;
import com.grcplatform.api.web.guard.RequirePermission;
import com.grcplatform.api.web.guard.RequireRoles;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.context.SecurityContextHolder;
import com.grcplatform.security.permission.Role;
import com.grcplatform.security.quota.QuotaEnforcer;
import com.grcplatform.security.quota.QuotaStore;
import com.grcplatform.security.quota.QuotaType;
import com.grcplatform.security.tenant.TenantQuota;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Usage counters of a tenant, for its owners.
 */
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/usage")
@RequireRoles(Role.TENANT_OWNER)
@PreventCrossTenantAccess
public class TenantUsageController {

    public record UsageResponse(String tenantId, Map<String, Long> usage, Map<String, Long> limits) {
    }

    public record RecordTokensRequest(@Positive long amount) {
    }

    private final QuotaStore quotaStore;
    private final QuotaEnforcer quotaEnforcer;

    public TenantUsageController(QuotaStore quotaStore, QuotaEnforcer quotaEnforcer) {
        this.quotaStore = quotaStore;
        this.quotaEnforcer = quotaEnforcer;
    }

    @GetMapping
    @RequirePermission(resource = "billing")
    public UsageResponse usage(@PathVariable String tenantId) {
        return snapshot(SecurityContextHolder.require());
    }

    /** Adds model tokens consumed outside this service to the monthly counter. */
    @PostMapping("/tokens")
    @EnforceQuota(QuotaType.TOKENS)
    public UsageResponse recordTokens(@PathVariable String tenantId, @Valid @RequestBody RecordTokensRequest request) {
        SecurityContext ctx = SecurityContextHolder.require();
        quotaEnforcer.recordUsage(ctx.tenantId(), QuotaType.TOKENS, request.amount());
        return snapshot(ctx);
    }

    private UsageResponse snapshot(SecurityContext ctx) {
        Map<String, Long> usage = new LinkedHashMap<>();
        Map<String, Long> limits = new LinkedHashMap<>();
        TenantQuota quota = ctx.tenant().quota();
        for (QuotaType type : QuotaType.values()) {
            usage.put(type.value(), quotaStore.getUsage(ctx.tenantId(), type));
            if (quota != null) {
                limits.put(type.value(), type.limitOf(quota));
            }
        }
        return new UsageResponse(ctx.tenantId(), usage, limits);
    }
}
