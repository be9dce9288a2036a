package com.grcplatform.security.guard;

import com.grcplatform.security.tenant.TenantIds;

/**
 * Answers whether a resource belongs to a tenant.
 */
@FunctionalInterface
public interface TenantResourceLocator {

    boolean belongsToTenant(String resourceType, String resourceId, String tenantId);

    /** Locator reading the owning tenant from a record store; unknown resources belong to no one. */
    static TenantResourceLocator fromStore(ResourceRecordStore store) {
        return (type, id, tenantId) -> store.find(type, id)
                .map(r -> TenantIds.sameTenant(r.tenantId(), tenantId))
                .orElse(false);
    }
}
