package com.grcplatform.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.function.Supplier;

/**
 * Thin wrapper around the OpenTelemetry {@link Tracer} that attaches correlation context
 * attributes to every span.
 * <p>
 * Only the API is used here; with no SDK installed the tracer is a no-op and spans cost nothing.
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given tracer.
     *
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Executes the supplier within a new internal span. Runtime exceptions are recorded on the
     * span and rethrown unchanged.
     *
     * @param spanName name for the span
     * @param work     the work to execute within the span
     * @param <T>      return type
     * @return the result of the supplier
     */
    public <T> T inSpan(String spanName, Supplier<T> work) {
        Span span = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL).startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute("tenant.id", ctx.tenantId());
            }
            if (ctx.userId() != null) {
                span.setAttribute("user.id", ctx.userId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
