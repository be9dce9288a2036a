package com.grcplatform.api.api;

import com.grcplatform.api.store.InMemoryDirectory;
import com.grcplatform.api.web.guard.EnforceQuota;
import com.grcplatform.api.web.guard.PreventCrossTenantAccess;
import com.grcplatform.api.web.guard.RequirePermission;
import com.grcplatform.api.web.guard.RequireResourceAccess;
import com.grcplatform.api.web.guard.RequireRoles;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.context.SecurityContextHolder;
import com.grcplatform.security.guard.AgentAccessChecker;
import com.grcplatform.security.guard.ResourceRecord;
import com.grcplatform.security.permission.Action;
import com.grcplatform.security.permission.Role;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Agents of the caller's tenant.
 */
@RestController
@RequestMapping("/api/v1/agents")
@EnforceQuota
public class AgentController {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    public record CreateAgentRequest(@NotBlank String name, String tenantId) {
    }

    public record AgentResponse(String id, String name, String tenantId, String createdBy) {
    }

    private final InMemoryDirectory directory;
    private final Map<String, String> names = new ConcurrentHashMap<>();

    public AgentController(InMemoryDirectory directory) {
        this.directory = directory;
    }

    @GetMapping
    @RequirePermission(resource = "agents")
    public List<AgentResponse> list() {
        SecurityContext ctx = SecurityContextHolder.require();
        return directory.resourcesOf(AgentAccessChecker.RESOURCE_TYPE, ctx.tenantId()).stream()
                .map(this::toResponse)
                .toList();
    }

    @GetMapping("/{id}")
    @RequirePermission(resource = "agents")
    @RequireResourceAccess(type = AgentAccessChecker.RESOURCE_TYPE)
    public AgentResponse get(@PathVariable String id) {
        return directory.find(AgentAccessChecker.RESOURCE_TYPE, id)
                .map(this::toResponse)
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent " + id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @RequirePermission(resource = "agents", actions = Action.WRITE)
    @PreventCrossTenantAccess
    public AgentResponse create(@Valid @RequestBody CreateAgentRequest request) {
        SecurityContext ctx = SecurityContextHolder.require();
        var record = new ResourceRecord(
                AgentAccessChecker.RESOURCE_TYPE, UUID.randomUUID().toString(), ctx.tenantId(), ctx.userId());
        names.put(record.resourceId(), request.name());
        directory.putResource(record);
        log.info("Agent {} created in tenant {}", record.resourceId(), ctx.tenantId());
        return toResponse(record);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @RequireRoles(Role.TENANT_OWNER)
    @RequireResourceAccess(type = AgentAccessChecker.RESOURCE_TYPE)
    public void delete(@PathVariable String id) {
        directory.removeResource(AgentAccessChecker.RESOURCE_TYPE, id);
        names.remove(id);
        log.info("Agent {} deleted", id);
    }

    private AgentResponse toResponse(ResourceRecord record) {
        return new AgentResponse(
                record.resourceId(), names.get(record.resourceId()), record.tenantId(), record.createdBy());
    }
}
