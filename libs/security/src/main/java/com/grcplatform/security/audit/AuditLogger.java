package com.grcplatform.security.audit;

import com.grcplatform.auditmodel.AuditChain;
import com.grcplatform.auditmodel.AuditEvent;
import com.grcplatform.auditmodel.AuditEventFactory;
import com.grcplatform.auditmodel.AuditEventType;
import com.grcplatform.auditmodel.AuditEventValidator;
import com.grcplatform.auditmodel.ValidationResult;
import com.grcplatform.observability.CorrelationContext;
import com.grcplatform.observability.CorrelationContextHolder;
import com.grcplatform.observability.SecurityMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Records security decisions without slowing down or failing the request that made them.
 * <p>
 * Events are chained into an {@link AuditChain} and written to the {@link AuditSink} by a single
 * background thread, so sink order equals chain order. When the sink fails or the queue is full
 * the event goes to the {@code grc.audit.fallback} logger instead and the drop is counted.
 * {@link #log(AuditEvent)} and {@link #record} never throw.
 */
public class AuditLogger implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Logger fallback = LoggerFactory.getLogger("grc.audit.fallback");

    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private final AuditSink sink;
    private final SecurityMetrics metrics;
    private final Clock clock;
    private final AuditChain chain = new AuditChain();
    private final ThreadPoolExecutor writer;

    public AuditLogger(AuditSink sink, SecurityMetrics metrics, Clock clock) {
        this(sink, metrics, clock, DEFAULT_QUEUE_CAPACITY);
    }

    public AuditLogger(AuditSink sink, SecurityMetrics metrics, Clock clock, int queueCapacity) {
        if (sink == null || clock == null) {
            throw new IllegalArgumentException("sink and clock are required");
        }
        this.sink = sink;
        this.metrics = metrics;
        this.clock = clock;
        this.writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "grc-audit-writer");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Builds an event for the current request and logs it. Client IP, user agent and
     * correlation id come from the {@link CorrelationContextHolder}. Callers redact request
     * payloads before passing them in.
     */
    public void record(AuditEventType type, String userId, String tenantId, Map<String, Object> details) {
        AuditEvent event;
        try {
            AuditEventFactory.RequestOrigin origin = CorrelationContextHolder.get()
                    .map(AuditLogger::originOf)
                    .orElse(AuditEventFactory.RequestOrigin.unknown());
            event = AuditEventFactory.create(type, userId, tenantId, details, origin, clock);
        } catch (RuntimeException e) {
            fallback.error("Failed to build audit event type={} userId={} tenantId={}",
                    type.value(), userId, tenantId, e);
            dropped();
            return;
        }
        log(event);
    }

    /**
     * Queues an event for chaining and writing.
     */
    public void log(AuditEvent event) {
        ValidationResult validation = AuditEventValidator.validate(event);
        if (!validation.valid()) {
            log.warn("Audit event {} failed validation: {}", event == null ? null : event.eventId(),
                    validation.errors());
        }
        if (event == null) {
            return;
        }
        try {
            writer.execute(() -> write(event));
        } catch (RejectedExecutionException e) {
            fallback.error("Audit queue rejected event {} type={}: {}",
                    event.eventId(), event.eventType().value(), e.getMessage());
            dropped();
        }
    }

    private void write(AuditEvent event) {
        try {
            sink.write(chain.append(event));
        } catch (RuntimeException e) {
            fallback.error("Audit sink failed for event {} type={} tenantId={}",
                    event.eventId(), event.eventType().value(), event.tenantId(), e);
            dropped();
        }
    }

    private void dropped() {
        if (metrics != null) {
            metrics.auditDropped();
        }
    }

    private static AuditEventFactory.RequestOrigin originOf(CorrelationContext ctx) {
        return new AuditEventFactory.RequestOrigin(ctx.correlationId(), ctx.clientIp(), ctx.userAgent());
    }

    /** The chain events are appended to. */
    public AuditChain chain() {
        return chain;
    }

    /**
     * Waits until every event queued before this call has been written, up to {@code timeout}.
     *
     * @return true if the queue drained in time
     */
    public boolean flush(Duration timeout) {
        try {
            writer.submit(() -> { }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException | ExecutionException | TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stops accepting events and drains the queue.
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                int pending = writer.shutdownNow().size();
                fallback.error("Audit writer did not drain in time, {} events lost", pending);
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
