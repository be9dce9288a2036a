package com.grcplatform.security.guard;

import com.grcplatform.security.context.SecurityContext;

/**
 * Chat sessions are private to the user who started them.
 */
public class ChatSessionAccessChecker extends StoreBackedAccessChecker {

    public static final String RESOURCE_TYPE = "chat-session";

    public ChatSessionAccessChecker(ResourceRecordStore store) {
        super(RESOURCE_TYPE, store);
    }

    @Override
    protected boolean permits(SecurityContext ctx, ResourceRecord record) {
        return isCreator(ctx, record);
    }
}
