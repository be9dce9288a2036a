package com.grcplatform.security.guard;

import com.grcplatform.security.context.SecurityContext;

/**
 * Per-resource-type access rule for callers who are neither platform nor tenant owners.
 */
public interface ResourceAccessChecker {

    /** The resource type this checker decides for. */
    String resourceType();

    boolean canAccess(SecurityContext ctx, String resourceId);
}
