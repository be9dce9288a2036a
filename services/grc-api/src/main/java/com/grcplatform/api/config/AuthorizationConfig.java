package com.grcplatform.api.config;

import com.grcplatform.api.store.InMemoryDirectory;
import com.grcplatform.observability.SecurityMetrics;
import com.grcplatform.observability.SensitiveDataRedactor;
import com.grcplatform.observability.SpanHelper;
import com.grcplatform.security.audit.AuditLogger;
import com.grcplatform.security.audit.Slf4jAuditSink;
import com.grcplatform.security.guard.AgentAccessChecker;
import com.grcplatform.security.guard.ChatSessionAccessChecker;
import com.grcplatform.security.guard.CrossTenantGuard;
import com.grcplatform.security.guard.LlmConfigAccessChecker;
import com.grcplatform.security.guard.PermissionGuard;
import com.grcplatform.security.guard.ResourceOwnershipGuard;
import com.grcplatform.security.guard.RoleGuard;
import com.grcplatform.security.guard.TenantResourceLocator;
import com.grcplatform.security.key.HttpKeyDiscoveryClient;
import com.grcplatform.security.key.JwksKeyResolver;
import com.grcplatform.security.key.KeyResolver;
import com.grcplatform.security.pipeline.AuthenticationPipeline;
import com.grcplatform.security.quota.InMemoryQuotaStore;
import com.grcplatform.security.quota.QuotaEnforcer;
import com.grcplatform.security.quota.QuotaStore;
import com.grcplatform.security.tenant.TenantResolver;
import com.grcplatform.security.token.TokenVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.net.MalformedURLException;
import java.net.URI;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.task.TaskExecutionAutoConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the authorization core into the Spring context.
 */
@Configuration
public class AuthorizationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SecurityMetrics securityMetrics(MeterRegistry meterRegistry, GrcServiceProperties service) {
        return new SecurityMetrics(meterRegistry, service.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("grc-authz"));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean(destroyMethod = "close")
    public AuditLogger auditLogger(SecurityMetrics metrics, Clock clock, GrcAuthProperties auth) {
        return new AuditLogger(new Slf4jAuditSink(), metrics, clock, auth.auditQueueCapacity());
    }

    @Bean
    public InMemoryDirectory directory() {
        return new InMemoryDirectory();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public JwksKeyResolver jwksKeyResolver(
            GrcAuthProperties auth,
            Clock clock,
            @Qualifier(TaskExecutionAutoConfiguration.APPLICATION_TASK_EXECUTOR_BEAN_NAME) Executor taskExecutor)
            throws MalformedURLException {
        var client = new HttpKeyDiscoveryClient(
                URI.create(auth.jwksUri()).toURL(), auth.connectTimeout(), auth.readTimeout());
        return new JwksKeyResolver(client, auth.keyResolverConfig(), clock, taskExecutor);
    }

    @Bean
    public TokenVerifier tokenVerifier(KeyResolver keyResolver, GrcAuthProperties auth, Clock clock) {
        return new TokenVerifier(keyResolver, auth.tokenVerifierConfig(), clock);
    }

    @Bean
    public TenantResolver tenantResolver(InMemoryDirectory directory, AuditLogger auditLogger) {
        return new TenantResolver(directory, auditLogger);
    }

    @Bean
    public AuthenticationPipeline authenticationPipeline(
            TokenVerifier tokenVerifier,
            InMemoryDirectory directory,
            TenantResolver tenantResolver,
            AuditLogger auditLogger,
            SecurityMetrics metrics,
            SpanHelper spanHelper) {
        return new AuthenticationPipeline(tokenVerifier, directory, tenantResolver, auditLogger, metrics, spanHelper);
    }

    @Bean
    public RoleGuard roleGuard(AuditLogger auditLogger) {
        return new RoleGuard(auditLogger);
    }

    @Bean
    public PermissionGuard permissionGuard(AuditLogger auditLogger) {
        return new PermissionGuard(auditLogger);
    }

    @Bean
    public ResourceOwnershipGuard resourceOwnershipGuard(AuditLogger auditLogger, InMemoryDirectory directory) {
        return new ResourceOwnershipGuard(
                auditLogger,
                TenantResourceLocator.fromStore(directory),
                List.of(new AgentAccessChecker(directory),
                        new LlmConfigAccessChecker(directory),
                        new ChatSessionAccessChecker(directory)));
    }

    @Bean
    public CrossTenantGuard crossTenantGuard(AuditLogger auditLogger, SensitiveDataRedactor redactor) {
        return new CrossTenantGuard(auditLogger, redactor);
    }

    @Bean
    public InMemoryQuotaStore quotaStore(Clock clock) {
        return new InMemoryQuotaStore(clock);
    }

    @Bean
    public QuotaEnforcer quotaEnforcer(QuotaStore quotaStore, AuditLogger auditLogger) {
        return new QuotaEnforcer(quotaStore, auditLogger);
    }
}
