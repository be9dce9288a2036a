package com.grcplatform.security.guard;

import java.util.Optional;

/**
 * Looks up ownership records of tenant-scoped resources.
 */
public interface ResourceRecordStore {

    Optional<ResourceRecord> find(String resourceType, String resourceId);
}
