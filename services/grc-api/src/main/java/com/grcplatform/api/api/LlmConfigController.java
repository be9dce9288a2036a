package com.grcplatform.api.api;

import com.grcplatform.api.store.InMemoryDirectory;
import com.grcplatform.api.web.guard.RequirePermission;
import com.grcplatform.api.web.guard.RequireResourceAccess;
import com.grcplatform.security.guard.LlmConfigAccessChecker;
import com.grcplatform.security.guard.ResourceRecord;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/llm-configs")
public class LlmConfigController {

    private final InMemoryDirectory directory;

    public LlmConfigController(InMemoryDirectory directory) {
        this.directory = directory;
    }

    @GetMapping("/{id}")
    @RequirePermission(resource = "llm-configs")
    @RequireResourceAccess(type = LlmConfigAccessChecker.RESOURCE_TYPE)
    public ResourceRecord get(@PathVariable String id) {
        return directory.find(LlmConfigAccessChecker.RESOURCE_TYPE, id)
                .orElseThrow(() -> new IllegalArgumentException("Unknown LLM configuration " + id));
    }
}
