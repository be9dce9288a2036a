package com.grcplatform.security.guard;

import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.permission.Action;

/**
 * LLM configurations are readable by anyone in the owning tenant holding {@code llm-configs:read}.
 */
public class LlmConfigAccessChecker extends StoreBackedAccessChecker {

    public static final String RESOURCE_TYPE = "llm-config";

    public LlmConfigAccessChecker(ResourceRecordStore store) {
        super(RESOURCE_TYPE, store);
    }

    @Override
    protected boolean permits(SecurityContext ctx, ResourceRecord record) {
        return ctx.principal().can("llm-configs", Action.READ);
    }
}
