package com.grcplatform.security.tenant;

import java.util.List;
import java.util.Optional;

/**
 * Read access to user accounts and their per-tenant role assignments.
 */
public interface UserStore {

    Optional<UserAccount> getUserByProviderSubject(String providerSubject);

    /**
     * Returns the role names assigned to the user in the tenant, as stored.
     * Unknown names are tolerated by callers.
     */
    List<String> getUserRolesForTenant(String userId, String tenantId);
}
