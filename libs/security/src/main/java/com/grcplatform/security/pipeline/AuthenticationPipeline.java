package com.grcplatform.security.pipeline;

import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.observability.CorrelationContextHolder;
import com.grcplatform.observability.SecurityMetrics;
import com.grcplatform.observability.SpanHelper;
import com.grcplatform.security.AuthErrorCode;
import com.grcplatform.security.AuthorizationException;
import com.grcplatform.security.audit.AuditLogger;
import com.grcplatform.security.context.Principal;
import com.grcplatform.security.context.SecurityContext;
import com.grcplatform.security.permission.PermissionDeriver;
import com.grcplatform.security.permission.PermissionSet;
import com.grcplatform.security.permission.Role;
import com.grcplatform.security.tenant.Tenant;
import com.grcplatform.security.tenant.TenantResolver;
import com.grcplatform.security.tenant.UserAccount;
import com.grcplatform.security.tenant.UserStore;
import com.grcplatform.security.token.BearerTokenExtractor;
import com.grcplatform.security.token.ClaimSet;
import com.grcplatform.security.token.TokenFailure;
import com.grcplatform.security.token.TokenVerificationException;
import com.grcplatform.security.token.TokenVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Turns request headers into a {@link SecurityContext}.
 * <p>
 * Stages run strictly in order and the first failure ends the request: bearer token, token
 * verification, tenant header, user lookup, tenant resolution, role lookup, permission derivation. Success and
 * token failures are audited; tenant failures are audited by {@link TenantResolver}.
 */
public class AuthenticationPipeline {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationPipeline.class);

    static final String STAGE = "authentication";

    private final TokenVerifier tokenVerifier;
    private final UserStore userStore;
    private final TenantResolver tenantResolver;
    private final AuditLogger auditLogger;
    private final SecurityMetrics metrics;
    private final SpanHelper spanHelper;

    public AuthenticationPipeline(
            TokenVerifier tokenVerifier,
            UserStore userStore,
            TenantResolver tenantResolver,
            AuditLogger auditLogger,
            SecurityMetrics metrics,
            SpanHelper spanHelper
    ) {
        this.tokenVerifier = tokenVerifier;
        this.userStore = userStore;
        this.tenantResolver = tenantResolver;
        this.auditLogger = auditLogger;
        this.metrics = metrics;
        this.spanHelper = spanHelper;
    }

    /**
     * @throws AuthorizationException naming the first stage that rejected the request
     */
    public SecurityContext authenticate(AuthenticationRequest request) {
        try {
            SecurityContext ctx = doAuthenticate(request);
            metrics.allowed(STAGE);
            return ctx;
        } catch (AuthorizationException e) {
            metrics.denied(STAGE, e.errorCode().code());
            throw e;
        }
    }

    private SecurityContext doAuthenticate(AuthenticationRequest request) {
        String token = BearerTokenExtractor.extract(request.authorizationHeader())
                .orElseThrow(() -> new AuthorizationException(AuthErrorCode.MISSING_AUTH_TOKEN));

        ClaimSet claims = verify(token);
        String tenantId = TenantResolver.requireTenantId(request.tenantHeader());

        String subject = claims.objectId();
        UserAccount user = storeCall(() -> userStore.getUserByProviderSubject(subject), "getUserByProviderSubject")
                .orElseThrow(() -> {
                    log.info("No local account for subject {}", subject);
                    return new AuthorizationException(AuthErrorCode.USER_NOT_FOUND);
                });

        Tenant tenant = tenantResolver.resolve(user, tenantId);

        Set<Role> roles = rolesOf(user, tenant);
        PermissionSet permissions = PermissionDeriver.derive(roles);

        Principal principal = new Principal(
                user.userId(),
                subject,
                claims.email().orElse(user.email()),
                claims.displayName().orElse(user.name()),
                tenant.tenantId(),
                roles,
                permissions);
        SecurityContext ctx = new SecurityContext(principal, tenant, claims);

        CorrelationContextHolder.bindPrincipal(tenant.tenantId(), user.userId());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("roles", roles.stream().map(Role::value).sorted().toList());
        auditLogger.record(AuditEventType.AUTHENTICATION_SUCCESS, user.userId(), tenant.tenantId(), details);
        return ctx;
    }

    private ClaimSet verify(String token) {
        long start = System.nanoTime();
        try {
            ClaimSet claims = spanHelper.inSpan("authz.token.verify", () -> tokenVerifier.verify(token));
            metrics.recordTokenVerification(Duration.ofNanos(System.nanoTime() - start), true);
            return claims;
        } catch (TokenVerificationException e) {
            metrics.recordTokenVerification(Duration.ofNanos(System.nanoTime() - start), false);
            if (e.failure() == TokenFailure.KEY_DISCOVERY_UNAVAILABLE) {
                log.error("Token rejected, signing keys unavailable", e);
            } else {
                log.info("Token rejected: {} ({})", e.failure(), e.getMessage());
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", e.failure().name());
            auditLogger.record(AuditEventType.AUTHENTICATION_FAILURE, null, null, details);
            throw new AuthorizationException(AuthErrorCode.AUTHENTICATION_FAILED,
                    AuthErrorCode.AUTHENTICATION_FAILED.defaultMessage(), e);
        }
    }

    private Set<Role> rolesOf(UserAccount user, Tenant tenant) {
        List<String> names = storeCall(
                () -> userStore.getUserRolesForTenant(user.userId(), tenant.tenantId()), "getUserRolesForTenant");
        Set<Role> roles = EnumSet.noneOf(Role.class);
        if (names == null) {
            return roles;
        }
        for (String name : names) {
            Optional<Role> role = Role.fromString(name);
            if (role.isPresent()) {
                roles.add(role.get());
            } else {
                log.warn("Ignoring unknown role '{}' for user {} in tenant {}", name, user.userId(), tenant.tenantId());
            }
        }
        return roles;
    }

    private static <T> T storeCall(Supplier<T> call, String operation) {
        try {
            return call.get();
        } catch (RuntimeException e) {
            log.error("User store {} failed", operation, e);
            throw new AuthorizationException(AuthErrorCode.INTERNAL_ERROR,
                    AuthErrorCode.INTERNAL_ERROR.defaultMessage(), e);
        }
    }
}
