package com.atrium.observability;

import org.slf4j.MDC;

import java.util.Optional;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys (correlationId, tenantId, userId, requestId) are
 * populated so every log statement on this thread carries them. When cleared, all keys
 * are removed. Servlet threads are pooled, so the web filter that sets the context must
 * clear it in a {@code finally} block.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the current correlation ID, or {@code null} outside a request.
     */
    public static String currentCorrelationId() {
        CorrelationContext context = CONTEXT.get();
        return context != null ? context.correlationId() : null;
    }

    /**
     * Attaches the resolved caller to the current context. No-op when no context is set
     * (e.g. when the pipeline is driven directly from a test or a seeding job).
     */
    public static void bindCaller(long tenantId, long userId) {
        CorrelationContext context = CONTEXT.get();
        if (context != null) {
            set(context.withCaller(tenantId, userId));
        }
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(CorrelationContext.MDC_USER_ID, ctx.userId());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
