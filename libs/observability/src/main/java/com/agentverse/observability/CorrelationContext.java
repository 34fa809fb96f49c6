package com.agentverse.observability;

/**
 * Immutable per-request correlation data.
 * <p>
 * Established once per incoming request and mirrored into the SLF4J MDC by
 * {@link CorrelationContextHolder}, so every log line of the request carries it.
 *
 * @param correlationId unique ID for the business flow, propagated via {@code X-Correlation-ID}
 * @param subjectId     caller subject id (nullable until the identity is resolved)
 * @param requestId     unique ID for this specific request
 * @param traceId       current OpenTelemetry trace ID (nullable if tracing is not active)
 */
public record CorrelationContext(
        String correlationId,
        String subjectId,
        String requestId,
        String traceId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_SUBJECT_ID = "subjectId";
    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only a correlation id. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /** Returns a copy with the subject id set, once the caller is known. */
    public CorrelationContext withSubject(String subjectId) {
        return new CorrelationContext(correlationId, subjectId, requestId, traceId);
    }
}
