package com.grcplatform.security.guard;

/**
 * Ownership facts about a tenant-scoped resource.
 *
 * @param resourceType e.g. "agent"
 * @param resourceId   resource identifier
 * @param tenantId     owning tenant
 * @param createdBy    user id of the creator, may be null
 */
public record ResourceRecord(String resourceType, String resourceId, String tenantId, String createdBy) {
}
