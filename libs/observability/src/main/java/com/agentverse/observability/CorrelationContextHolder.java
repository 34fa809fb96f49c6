package com.agentverse.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with an SLF4J MDC bridge.
 * <p>
 * Setting a context populates the MDC keys of {@link CorrelationContext}; clearing it
 * removes them. Work handed to another thread must carry the context explicitly via
 * {@link #runWithContext(CorrelationContext, Runnable)}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        put(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        put(CorrelationContext.MDC_SUBJECT_ID, context.subjectId());
        put(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        put(CorrelationContext.MDC_TRACE_ID, context.traceId());
    }

    /** Returns the current thread's context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Records the resolved caller on the current context. No-op when no context is set.
     */
    public static void bindSubject(String subjectId) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withSubject(subjectId));
        }
    }

    /** Clears the context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_SUBJECT_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
    }

    /**
     * Runs the work with the given context set, then restores the previous context
     * (or clears it if there was none).
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
