package com.agentverse.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that attaches the current
 * correlation context to every span.
 * <p>
 * Does not configure the SDK; without one the API hands out no-op spans.
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * @param tracer the tracer (e.g. {@code GlobalOpenTelemetry.getTracer("authz")})
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs the work in a new span. Runtime exceptions are recorded on the span, which is
     * marked as failed, and rethrown unchanged.
     */
    public <T> T inSpan(String spanName, SpanKind kind, Map<String, String> attributes,
                        Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(kind);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.subjectId() != null) {
                span.setAttribute("subject.id", ctx.subjectId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }
}
