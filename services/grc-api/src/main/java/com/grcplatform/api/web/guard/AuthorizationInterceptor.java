package com.grcplatform.api.web.guard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grcplatform.api.web.AuthenticationFilter;
import com.grcplatform.api.web.CachedBodyRequest;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.context.SecurityContextHolder;
import com.grcplatform.security.guard.CrossTenantGuard;
import com.grcplatform.security.guard.PermissionGuard;
import com.grcplatform.security.guard.PermissionRequirement;
import com.grcplatform.security.guard.ResourceOwnershipGuard;
import com.grcplatform.security.guard.RoleGuard;
import com.grcplatform.security.quota.QuotaEnforcer;
import com.grcplatform.security.quota.QuotaType;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;
import org.springframework.web.util.WebUtils;

/**
 * Applies the guard annotations of the matched handler, in a fixed order: roles, permissions,
 * resource ownership, cross-tenant, quota. The first failing guard ends the request.
 *
 * <p>Method-level annotations are combined with those on the controller class.
 */
@Component
public class AuthorizationInterceptor implements HandlerInterceptor {

    private final RoleGuard roleGuard;
    private final PermissionGuard permissionGuard;
    private final ResourceOwnershipGuard resourceOwnershipGuard;
    private final CrossTenantGuard crossTenantGuard;
    private final QuotaEnforcer quotaEnforcer;
    private final ObjectMapper objectMapper;

    public AuthorizationInterceptor(
            RoleGuard roleGuard,
            PermissionGuard permissionGuard,
            ResourceOwnershipGuard resourceOwnershipGuard,
            CrossTenantGuard crossTenantGuard,
            QuotaEnforcer quotaEnforcer,
            ObjectMapper objectMapper) {
        this.roleGuard = roleGuard;
        this.permissionGuard = permissionGuard;
        this.resourceOwnershipGuard = resourceOwnershipGuard;
        this.crossTenantGuard = crossTenantGuard;
        this.quotaEnforcer = quotaEnforcer;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }

        RequireRoles roles = find(method, RequireRoles.class);
        List<RequirePermission> permissions = findRepeatable(method);
        RequireResourceAccess resourceAccess = method.getMethodAnnotation(RequireResourceAccess.class);
        PreventCrossTenantAccess crossTenant = find(method, PreventCrossTenantAccess.class);
        EnforceQuota quota = find(method, EnforceQuota.class);
        if (roles == null && permissions.isEmpty() && resourceAccess == null && crossTenant == null && quota == null) {
            return true;
        }

        SecurityContext ctx = currentContext(request);
        if (roles != null) {
            roleGuard.require(ctx, roles.value());
        }
        if (!permissions.isEmpty()) {
            List<PermissionRequirement> requirements = new ArrayList<>();
            for (RequirePermission p : permissions) {
                requirements.add(PermissionRequirement.of(p.resource(), p.actions()));
            }
            permissionGuard.require(ctx, requirements);
        }
        if (resourceAccess != null) {
            resourceOwnershipGuard.require(ctx, resourceAccess.type(), resourceId(request, resourceAccess.idParam()));
        }
        if (crossTenant != null) {
            crossTenantGuard.check(ctx, pathVariables(request), jsonBody(request));
        }
        if (quota != null) {
            Set<QuotaType> types = new LinkedHashSet<>(Arrays.asList(quota.value()));
            for (QuotaType type : types) {
                quotaEnforcer.check(ctx, type);
            }
        }
        return true;
    }

    private static SecurityContext currentContext(HttpServletRequest request) {
        Object attribute = request.getAttribute(AuthenticationFilter.SECURITY_CONTEXT_ATTRIBUTE);
        if (attribute instanceof SecurityContext ctx) {
            return ctx;
        }
        return SecurityContextHolder.require();
    }

    private static <A extends Annotation> A find(HandlerMethod method, Class<A> type) {
        A onMethod = method.getMethodAnnotation(type);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), type);
    }

    private static List<RequirePermission> findRepeatable(HandlerMethod method) {
        List<RequirePermission> result = new ArrayList<>(
                AnnotatedElementUtils.findMergedRepeatableAnnotations(method.getBeanType(), RequirePermission.class));
        result.addAll(AnnotatedElementUtils.findMergedRepeatableAnnotations(method.getMethod(), RequirePermission.class));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> pathVariables(HttpServletRequest request) {
        Object vars = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        return vars instanceof Map<?, ?> map ? (Map<String, String>) map : Map.of();
    }

    private static String resourceId(HttpServletRequest request, String param) {
        String fromPath = pathVariables(request).get(param);
        return fromPath != null ? fromPath : request.getParameter(param);
    }

    private Object jsonBody(HttpServletRequest request) {
        CachedBodyRequest cached = WebUtils.getNativeRequest(request, CachedBodyRequest.class);
        if (cached == null) {
            return null;
        }
        byte[] body = cached.body();
        if (body.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            throw new AuthorizationException(AuthErrorCode.BAD_REQUEST, "Request body is not valid JSON", e);
        } catch (IOException e) {
            throw new AuthorizationException(AuthErrorCode.INTERNAL_ERROR, AuthErrorCode.INTERNAL_ERROR.defaultMessage(), e);
        }
    }
}
