package com.grcplatform.api.store;

import com.grcplatform.security.guard.ResourceRecord;
import com.grcplatform.security.guard.ResourceRecordStore;
import com.grcplatform.security.tenant.Tenant;
import com.grcplatform.security.tenant.TenantIds;
import com.grcplatform.security.tenant.TenantStore;
import com.grcplatform.security.tenant.UserAccount;
import com.grcplatform.security.tenant.UserStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local tenant, user, membership and resource directory.
 *
 * <p>Backs the service until the platform's relational store is wired in. Tenant ids are kept
 * normalized so lookups are case-insensitive.
 */
public class InMemoryDirectory implements TenantStore, UserStore, ResourceRecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDirectory.class);

    private final Map<String, Tenant> tenants = new ConcurrentHashMap<>();
    private final Map<String, UserAccount> usersBySubject = new ConcurrentHashMap<>();
    // userId -> tenantId -> role names
    private final Map<String, Map<String, List<String>>> memberships = new ConcurrentHashMap<>();
    private final Map<String, ResourceRecord> resources = new ConcurrentHashMap<>();

    public void putTenant(Tenant tenant) {
        tenants.put(TenantIds.normalize(tenant.tenantId()), tenant);
    }

    public void putUser(UserAccount user) {
        if (user.providerSubject() == null || user.providerSubject().isBlank()) {
            throw new IllegalArgumentException("providerSubject must not be blank");
        }
        usersBySubject.put(user.providerSubject(), user);
    }

    /** Makes the user a member of the tenant with the given role names, replacing earlier ones. */
    public void grant(String userId, String tenantId, Collection<String> roleNames) {
        memberships.computeIfAbsent(userId, k -> new ConcurrentHashMap<>())
                .put(TenantIds.normalize(tenantId), List.copyOf(roleNames));
        log.debug("Granted {} in tenant {} to user {}", roleNames, tenantId, userId);
    }

    public void revoke(String userId, String tenantId) {
        Map<String, List<String>> byTenant = memberships.get(userId);
        if (byTenant != null) {
            byTenant.remove(TenantIds.normalize(tenantId));
        }
    }

    public void putResource(ResourceRecord record) {
        resources.put(resourceKey(record.resourceType(), record.resourceId()), record);
    }

    public boolean removeResource(String resourceType, String resourceId) {
        return resources.remove(resourceKey(resourceType, resourceId)) != null;
    }

    /** Resources of a type owned by a tenant. */
    public List<ResourceRecord> resourcesOf(String resourceType, String tenantId) {
        List<ResourceRecord> result = new ArrayList<>();
        for (ResourceRecord record : resources.values()) {
            if (record.resourceType().equals(resourceType) && TenantIds.sameTenant(record.tenantId(), tenantId)) {
                result.add(record);
            }
        }
        result.sort((a, b) -> a.resourceId().compareTo(b.resourceId()));
        return result;
    }

    public void clear() {
        tenants.clear();
        usersBySubject.clear();
        memberships.clear();
        resources.clear();
    }

    @Override
    public Optional<Tenant> getTenantById(String tenantId) {
        return Optional.ofNullable(tenants.get(TenantIds.normalize(tenantId)));
    }

    @Override
    public boolean userHasAccessToTenant(String userId, String tenantId) {
        Map<String, List<String>> byTenant = memberships.get(userId);
        return byTenant != null && byTenant.containsKey(TenantIds.normalize(tenantId));
    }

    @Override
    public Optional<UserAccount> getUserByProviderSubject(String providerSubject) {
        if (providerSubject == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(usersBySubject.get(providerSubject));
    }

    @Override
    public List<String> getUserRolesForTenant(String userId, String tenantId) {
        Map<String, List<String>> byTenant = memberships.get(userId);
        if (byTenant == null) {
            return List.of();
        }
        return byTenant.getOrDefault(TenantIds.normalize(tenantId), List.of());
    }

    @Override
    public Optional<ResourceRecord> find(String resourceType, String resourceId) {
        return Optional.ofNullable(resources.get(resourceKey(resourceType, resourceId)));
    }

    private static String resourceKey(String resourceType, String resourceId) {
        return resourceType + ":" + resourceId;
    }
}
