package com.grcplatform.security.guard;

import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.permission.Role;

/**
 * Agents are visible to their creator and to every AgentUser of the owning tenant.
 */
public class AgentAccessChecker extends StoreBackedAccessChecker {

    public static final String RESOURCE_TYPE = "agent";

    public AgentAccessChecker(ResourceRecordStore store) {
        super(RESOURCE_TYPE, store);
    }

    @Override
    protected boolean permits(SecurityContext ctx, ResourceRecord record) {
        return isCreator(ctx, record) || ctx.principal().roles().contains(Role.AGENT_USER);
    }
}
