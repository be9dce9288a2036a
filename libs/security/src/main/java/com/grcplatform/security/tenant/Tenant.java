package com.grcplatform.security.tenant;

/**
 * An isolated customer organization.
 *
 * @param tenantId         UUID string
 * @param name             display name
 * @param subscriptionTier billing tier
 * @param status           lifecycle status
 * @param quota            usage limits, or null when the tenant has none configured
 */
public record Tenant(
        String tenantId,
        String name,
        SubscriptionTier subscriptionTier,
        TenantStatus status,
        TenantQuota quota) {

    public Tenant {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
    }

    public boolean isActive() {
        return status == TenantStatus.ACTIVE;
    }
}
