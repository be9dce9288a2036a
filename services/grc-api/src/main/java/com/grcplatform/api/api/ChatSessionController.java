package com.grcplatform.api.api;

import com.grcplatform.api.store.InMemoryDirectory;
import com.grcplatform.api.web.guard.EnforceQuota;
import com.grcplatform.api.web.guard.RequirePermission;
import com.grcplatform.api.web.guard.RequireResourceAccess;
import com.grcplatform.security.guard.ChatSessionAccessChecker;
import com.grcplatform.security.guard.ResourceRecord;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Chat sessions are private to their creator; tenant owners see all sessions of their tenant.
 */
@RestController
@RequestMapping("/api/v1/chat-sessions")
public class ChatSessionController {

    private final InMemoryDirectory directory;

    public ChatSessionController(InMemoryDirectory directory) {
        this.directory = directory;
    }

    @GetMapping("/{id}")
    @RequirePermission(resource = "chat")
    @RequireResourceAccess(type = ChatSessionAccessChecker.RESOURCE_TYPE)
    @EnforceQuota
    public ResourceRecord get(@PathVariable String id) {
        return directory.find(ChatSessionAccessChecker.RESOURCE_TYPE, id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown chat session " + id));
    }
}
