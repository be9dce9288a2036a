package com.grcplatform.security.guard;

import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.audit.AuditLogger;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.permission.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides whether the caller may touch one specific resource instance.
 * <ul>
 *   <li>PlatformOwner: always.</li>
 *   <li>TenantOwner: when the resource belongs to the authenticated tenant.</li>
 *   <li>Everyone else: the {@link ResourceAccessChecker} registered for the type; no checker
 *       means no access.</li>
 * </ul>
 */
public class ResourceOwnershipGuard {

    private static final Logger log = LoggerFactory.getLogger(ResourceOwnershipGuard.class);

    private final AuditLogger auditLogger;
    private final TenantResourceLocator locator;
    private final Map<String, ResourceAccessChecker> checkers = new HashMap<>();

    public ResourceOwnershipGuard(
            AuditLogger auditLogger, TenantResourceLocator locator, Collection<ResourceAccessChecker> checkers) {
        this.auditLogger = auditLogger;
        this.locator = locator;
        for (ResourceAccessChecker checker : checkers) {
            if (this.checkers.putIfAbsent(checker.resourceType(), checker) != null) {
                throw new IllegalArgumentException("Duplicate checker for resource type " + checker.resourceType());
            }
        }
    }

    /**
     * @throws AuthorizationException {@link AuthErrorCode#MISSING_RESOURCE_ID} for a blank id,
     *                                {@link AuthErrorCode#RESOURCE_ACCESS_DENIED} when access is refused
     */
    public void require(SecurityContext ctx, String resourceType, String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new AuthorizationException(AuthErrorCode.MISSING_RESOURCE_ID,
                    "Resource ID for '%s' is required".formatted(resourceType));
        }
        if (!canAccess(ctx, resourceType, resourceId)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("resourceType", resourceType);
            details.put("resourceId", resourceId);
            auditLogger.record(AuditEventType.UNAUTHORIZED_RESOURCE_ACCESS, ctx.userId(), ctx.tenantId(), details);
            throw new AuthorizationException(AuthErrorCode.RESOURCE_ACCESS_DENIED);
        }
    }

    private boolean canAccess(SecurityContext ctx, String resourceType, String resourceId) {
        var roles = ctx.principal().roles();
        try {
            if (roles.contains(Role.PLATFORM_OWNER)) {
                return true;
            }
            if (roles.contains(Role.TENANT_OWNER)) {
                return locator.belongsToTenant(resourceType, resourceId, ctx.tenantId());
            }
            ResourceAccessChecker checker = checkers.get(resourceType);
            if (checker == null) {
                log.warn("No access checker registered for resource type '{}', denying", resourceType);
                return false;
            }
            return checker.canAccess(ctx, resourceId);
        } catch (RuntimeException e) {
            log.error("Resource access check failed for {} {}", resourceType, resourceId, e);
            throw new AuthorizationException(AuthErrorCode.INTERNAL_ERROR,
                    AuthErrorCode.INTERNAL_ERROR.defaultMessage(), e);
        }
    }
}
