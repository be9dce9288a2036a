package com.grcplatform.security.guard;

import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.audit.AuditLogger;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.permission.Action;
import com.grcplatform.security.permission.PermissionSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requires every listed (resource, action) pair to be granted by the caller's permissions.
 */
public class PermissionGuard {

    private final AuditLogger auditLogger;

    public PermissionGuard(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    public void require(SecurityContext ctx, String resource, Action... actions) {
        require(ctx, List.of(PermissionRequirement.of(resource, actions)));
    }

    /**
     * @throws AuthorizationException with {@link AuthErrorCode#INSUFFICIENT_PERMISSIONS} listing
     *                                every missing {@code resource:action} pair
     */
    public void require(SecurityContext ctx, List<PermissionRequirement> requirements) {
        PermissionSet held = ctx.principal().permissions();
        List<String> missing = new ArrayList<>();
        for (PermissionRequirement req : requirements) {
            missing.addAll(held.missing(req.resource(), req.actions()));
        }
        if (missing.isEmpty()) {
            return;
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("missingPermissions", missing);
        Map<String, Object> auditDetails = new LinkedHashMap<>(details);
        auditDetails.put("userRoles", ctx.principal().roles().stream().map(r -> r.value()).sorted().toList());
        auditLogger.record(AuditEventType.AUTHORIZATION_FAILURE, ctx.userId(), ctx.tenantId(), auditDetails);
        throw new AuthorizationException(AuthErrorCode.INSUFFICIENT_PERMISSIONS,
                AuthErrorCode.INSUFFICIENT_PERMISSIONS.defaultMessage(), details);
    }
}
