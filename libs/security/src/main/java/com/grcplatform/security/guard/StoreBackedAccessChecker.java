package com.grcplatform.security.guard;

import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.tenant.TenantIds;

import java.util.Optional;

/**
 * Base for checkers that load the resource record, require it to belong to the caller's tenant
 * and then apply a type-specific rule.
 */
public abstract class StoreBackedAccessChecker implements ResourceAccessChecker {

    private final String resourceType;
    private final ResourceRecordStore store;

    protected StoreBackedAccessChecker(String resourceType, ResourceRecordStore store) {
        this.resourceType = resourceType;
        this.store = store;
    }

    @Override
    public String resourceType() {
        return resourceType;
    }

    @Override
    public boolean canAccess(SecurityContext ctx, String resourceId) {
        Optional<ResourceRecord> record = store.find(resourceType, resourceId);
        if (record.isEmpty() || !TenantIds.sameTenant(record.get().tenantId(), ctx.tenantId())) {
            return false;
        }
        return permits(ctx, record.get());
    }

    /** Rule applied once the record is known to belong to the caller's tenant. */
    protected abstract boolean permits(SecurityContext ctx, ResourceRecord record);

    protected static boolean isCreator(SecurityContext ctx, ResourceRecord record) {
        return record.createdBy() != null && record.createdBy().equals(ctx.userId());
    }
}
