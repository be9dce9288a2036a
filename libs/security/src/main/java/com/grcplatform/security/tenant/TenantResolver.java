package com.grcplatform.security.tenant;

import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.audit.AuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Resolves the tenant a request targets and checks the caller may act in it.
 * <p>
 * Checks in order: header present, UUID shaped, tenant exists, tenant active, user is a member.
 * A missing tenant and a non-member get the same response so tenant ids cannot be probed.
 */
public class TenantResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    private final TenantStore tenantStore;
    private final AuditLogger auditLogger;

    public TenantResolver(TenantStore tenantStore, AuditLogger auditLogger) {
        this.tenantStore = tenantStore;
        this.auditLogger = auditLogger;
    }

    /**
     * @param user         the authenticated user
     * @param tenantHeader raw value of the tenant header, may be null
     * @return the active tenant the user belongs to
     * @throws AuthorizationException on any failed check
     */
    public Tenant resolve(UserAccount user, String tenantHeader) {
        String tenantId = requireTenantId(tenantHeader);

        Optional<Tenant> found = call(() -> tenantStore.getTenantById(tenantId), "getTenantById", tenantId);
        if (found.isEmpty()) {
            log.warn("User {} requested unknown tenant {}", user.userId(), tenantId);
            denyAccess(user, tenantId);
        }
        Tenant tenant = found.get();

        if (!tenant.isActive()) {
            log.info("Tenant {} rejected request: status {}", tenantId, tenant.status().value());
            throw new AuthorizationException(AuthErrorCode.TENANT_INACTIVE);
        }

        boolean member = call(() -> tenantStore.userHasAccessToTenant(user.userId(), tenantId),
                "userHasAccessToTenant", tenantId);
        if (!member) {
            log.warn("User {} is not a member of tenant {}", user.userId(), tenantId);
            denyAccess(user, tenantId);
        }
        return tenant;
    }

    /**
     * Validates the raw tenant header without touching any store.
     *
     * @return the normalized tenant id
     * @throws AuthorizationException {@code MISSING_TENANT_ID} or {@code INVALID_TENANT_ID}
     */
    public static String requireTenantId(String tenantHeader) {
        if (tenantHeader == null || tenantHeader.isBlank()) {
            throw new AuthorizationException(AuthErrorCode.MISSING_TENANT_ID);
        }
        String requested = tenantHeader.strip();
        if (!TenantIds.isUuid(requested)) {
            throw new AuthorizationException(AuthErrorCode.INVALID_TENANT_ID);
        }
        return TenantIds.normalize(requested);
    }

    private void denyAccess(UserAccount user, String tenantId) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requestedTenant", tenantId);
        details.put("userPrimaryTenant", user.primaryTenantId());
        auditLogger.record(AuditEventType.UNAUTHORIZED_TENANT_ACCESS, user.userId(), tenantId, details);
        throw new AuthorizationException(AuthErrorCode.TENANT_ACCESS_DENIED);
    }

    private static <T> T call(Supplier<T> lookup, String operation, String tenantId) {
        try {
            return lookup.get();
        } catch (AuthorizationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Tenant store {} failed for tenant {}", operation, tenantId, e);
            throw new AuthorizationException(AuthErrorCode.INTERNAL_ERROR,
                    AuthErrorCode.INTERNAL_ERROR.defaultMessage(), e);
        }
    }
}
