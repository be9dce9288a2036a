package com.grcplatform.security.context;

import com.grcplatform.security.tenant.Tenant;
import com.grcplatform.security.token.ClaimSet;

/**
 * Everything downstream code may know about the authenticated request.
 *
 * @param principal the authenticated caller
 * @param tenant    the resolved, active tenant
 * @param claims    the verified token claims
 */
public record SecurityContext(Principal principal, Tenant tenant, ClaimSet claims) {

    public SecurityContext {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        if (tenant == null) {
            throw new IllegalArgumentException("tenant must not be null");
        }
    }

    public String tenantId() {
        return tenant.tenantId();
    }

    public String userId() {
        return principal.userId();
    }
}
