package com.grcplatform.security.guard;

import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.observability.SensitiveDataRedactor;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.audit.AuditLogger;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.permission.Action;
import com.grcplatform.security.permission.PermissionDeriver;
import com.grcplatform.security.tenant.TenantIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rejects requests that name a tenant other than the authenticated one.
 * <p>
 * Route parameters and the parsed JSON body (nested maps and lists) are scanned for
 * {@code tenant_id} and {@code tenantId}. Only UUID-shaped values count; comparison ignores
 * case. Callers with an explicit {@code cross-tenant} grant are not checked.
 */
public class CrossTenantGuard {

    private static final Logger log = LoggerFactory.getLogger(CrossTenantGuard.class);

    static final Set<String> TENANT_KEYS = Set.of("tenant_id", "tenantId");
    private static final int MAX_DEPTH = 32;

    private final AuditLogger auditLogger;
    private final SensitiveDataRedactor redactor;

    public CrossTenantGuard(AuditLogger auditLogger, SensitiveDataRedactor redactor) {
        this.auditLogger = auditLogger;
        this.redactor = redactor;
    }

    /**
     * @param routeParams path variables of the request, may be empty
     * @param body        parsed JSON body (map, list or scalar), may be null
     * @throws AuthorizationException with {@link AuthErrorCode#CROSS_TENANT_ACCESS_DENIED}
     */
    public void check(SecurityContext ctx, Map<String, String> routeParams, Object body) {
        if (ctx.principal().permissions().grantsExplicitly(PermissionDeriver.CROSS_TENANT, Action.READ)) {
            return;
        }
        List<String> foreign = new ArrayList<>();
        for (String tenantId : extractTenantIds(routeParams, body)) {
            if (!TenantIds.sameTenant(tenantId, ctx.tenantId())) {
                foreign.add(tenantId);
            }
        }
        if (foreign.isEmpty()) {
            return;
        }
        log.warn("User {} in tenant {} referenced foreign tenants {}", ctx.userId(), ctx.tenantId(), foreign);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("authenticatedTenant", ctx.tenantId());
        details.put("requestedTenants", foreign);
        details.put("routeParams", routeParams == null ? Map.of() : routeParams);
        details.put("requestBody", redactBody(body));
        auditLogger.record(AuditEventType.CROSS_TENANT_ACCESS_ATTEMPT, ctx.userId(), ctx.tenantId(), details);
        throw new AuthorizationException(AuthErrorCode.CROSS_TENANT_ACCESS_DENIED);
    }

    /**
     * Returns every UUID-shaped tenant id found under a conventional key, in encounter order.
     */
    public static Set<String> extractTenantIds(Map<String, String> routeParams, Object body) {
        Set<String> found = new LinkedHashSet<>();
        if (routeParams != null) {
            routeParams.forEach((key, value) -> collect(key, value, found));
        }
        scan(body, found, 0);
        return found;
    }

    private static void scan(Object node, Set<String> found, int depth) {
        if (depth > MAX_DEPTH) {
            return;
        }
        if (node instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getKey() instanceof String key) {
                    collect(key, entry.getValue(), found);
                }
                scan(entry.getValue(), found, depth + 1);
            }
        } else if (node instanceof List<?> list) {
            for (Object item : list) {
                scan(item, found, depth + 1);
            }
        }
    }

    private static void collect(String key, Object value, Set<String> found) {
        if (TENANT_KEYS.contains(key) && value instanceof String s && TenantIds.isUuid(s.strip())) {
            found.add(TenantIds.normalize(s));
        }
    }

    private Object redactBody(Object body) {
        if (body == null) {
            return Map.of();
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("body", body);
        return redactor.redact(wrapped).get("body");
    }
}
