package com.grcplatform.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters for authentication and authorization decisions.
 * <p>
 * Every meter carries a {@code service} tag. Decision counters are additionally tagged with the
 * pipeline stage that made the decision and the outcome code, so a dashboard can split
 * "token rejected" from "quota exceeded" without parsing logs. Tenant ids are deliberately not
 * used as tags: tenant counts are unbounded and would explode meter cardinality.
 */
public final class SecurityMetrics {

    /** Counter of authorization decisions, tagged by stage and outcome. */
    public static final String DECISIONS = "grc.authz.decisions";

    /** Timer around bearer token verification, including key resolution. */
    public static final String TOKEN_VERIFICATION = "grc.authz.token.verification";

    /** Counter of audit events that could not be delivered to the audit sink. */
    public static final String AUDIT_DROPPED = "grc.audit.dropped";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for pipeline stage (authentication, tenant, role, permission, ...). */
    public static final String TAG_STAGE = "stage";

    /** Tag key for decision outcome ("allowed" or an error code). */
    public static final String TAG_OUTCOME = "outcome";

    /** Outcome tag value for a passing decision. */
    public static final String OUTCOME_ALLOWED = "allowed";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates metrics bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public SecurityMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Records a passing decision for the given stage.
     */
    public void allowed(String stage) {
        decision(stage, OUTCOME_ALLOWED);
    }

    /**
     * Records a rejected decision for the given stage.
     *
     * @param stage pipeline stage that rejected the request
     * @param code  machine-readable error code (e.g. {@code QUOTA_EXCEEDED})
     */
    public void denied(String stage, String code) {
        decision(stage, code);
    }

    /**
     * Records how long a token verification took.
     */
    public void recordTokenVerification(Duration elapsed, boolean success) {
        Timer.builder(TOKEN_VERIFICATION)
                .description("Bearer token verification latency")
                .tags(baseTags().and(TAG_OUTCOME, success ? OUTCOME_ALLOWED : "rejected"))
                .register(registry)
                .record(elapsed);
    }

    /**
     * Counts an audit event that could not be persisted.
     */
    public void auditDropped() {
        Counter.builder(AUDIT_DROPPED)
                .description("Audit events that failed to reach the audit sink")
                .tags(baseTags())
                .register(registry)
                .increment();
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    private void decision(String stage, String outcome) {
        Counter.builder(DECISIONS)
                .description("Authentication and authorization decisions")
                .tags(baseTags().and(TAG_STAGE, stage, TAG_OUTCOME, outcome))
                .register(registry)
                .increment();
    }

    private Tags baseTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}
