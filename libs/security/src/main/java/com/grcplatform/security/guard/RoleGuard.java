package com.grcplatform.security.guard;

import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.audit.AuditLogger;
import com.grcplatform.security.context.Principal;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.permission.Role;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requires the caller to hold at least one of a set of roles.
 * <p>
 * A held role satisfies a requirement when it {@linkplain Role#implies implies} it, so
 * PlatformOwner passes every role check.
 */
public class RoleGuard {

    private final AuditLogger auditLogger;

    public RoleGuard(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    public void require(SecurityContext ctx, Role... anyOf) {
        require(ctx, Arrays.asList(anyOf));
    }

    /**
     * @throws AuthorizationException with {@link AuthErrorCode#INSUFFICIENT_PERMISSIONS} when no
     *                                held role satisfies any required role
     */
    public void require(SecurityContext ctx, Collection<Role> anyOf) {
        if (hasAnyRole(ctx.principal(), anyOf)) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("requiredRoles", values(anyOf));
        details.put("userRoles", values(ctx.principal().roles()));
        auditLogger.record(AuditEventType.AUTHORIZATION_FAILURE, ctx.userId(), ctx.tenantId(), details);
        throw new AuthorizationException(AuthErrorCode.INSUFFICIENT_PERMISSIONS,
                "User does not have required roles for this operation", details);
    }

    /**
     * True if the principal holds a role implying any of {@code anyOf}. An empty requirement
     * is always satisfied.
     */
    public static boolean hasAnyRole(Principal principal, Collection<Role> anyOf) {
        if (anyOf.isEmpty()) {
            return true;
        }
        for (Role required : anyOf) {
            if (principal.hasRole(required)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> values(Collection<Role> roles) {
        return roles.stream().map(Role::value).sorted().toList();
    }
}
