package com.grcplatform.api.api;

import com.grcplatform.api.web.guard.EnforceQuota;
import com.grcplatform.security.context.Principal;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.context.SecurityContextHolder;
import com.grcplatform.security.permission.Action;
import com.grcplatform.security.permission.Permission;
import com.grcplatform.security.permission.Role;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Returns the authenticated principal as resolved for the requested tenant.
 */
@RestController
@RequestMapping("/api/v1/me")
public class MeController {

    public record MeResponse(
            String userId,
            String email,
            String displayName,
            String tenantId,
            String tenantName,
            List<String> roles,
            Map<String, List<String>> permissions) {
    }

    @GetMapping
    @EnforceQuota
    public MeResponse me() {
        SecurityContext ctx = SecurityContextHolder.require();
        Principal principal = ctx.principal();
        List<String> roles = principal.roles().stream().map(Role::value).sorted().toList();
        Map<String, List<String>> permissions = new TreeMap<>();
        for (Permission permission : principal.permissions().permissions()) {
            permissions.put(permission.resource(),
                    permission.actions().stream().map(Action::value).sorted().toList());
        }
        return new MeResponse(
                principal.userId(),
                principal.email(),
                principal.displayName(),
                ctx.tenantId(),
                ctx.tenant().name(),
                roles,
                permissions);
    }
}
