package com.grcplatform.security.tenant;

/**
 * Usage limits of a tenant.
 *
 * @param dailyApiCalls API calls allowed per UTC day
 * @param monthlyTokens LLM tokens allowed per calendar month
 * @param storageGb     storage allowance in gigabytes
 */
public record TenantQuota(long dailyApiCalls, long monthlyTokens, long storageGb) {

    public TenantQuota {
        if (dailyApiCalls < 0 || monthlyTokens < 0 || storageGb < 0) {
            throw new IllegalArgumentException("quota limits must be >= 0");
        }
    }
}
