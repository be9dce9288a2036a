package com.grcplatform.security.tenant;

import java.util.Optional;

/**
 * Read access to tenant records. Implementations bound their own call latency and report
 * failures as unchecked exceptions.
 */
public interface TenantStore {

    Optional<Tenant> getTenantById(String tenantId);

    boolean userHasAccessToTenant(String userId, String tenantId);
}
