package com.smartcampus.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link RequestContext} with SLF4J MDC bridge.
 * <p>
 * When a context is set, the MDC keys {@code correlationId}, {@code tenantId},
 * {@code principalId} and {@code role} are populated; when cleared they are removed.
 * Servlet containers reuse threads, so whoever calls {@link #set(RequestContext)} at the
 * start of a request must call {@link #clear()} in a {@code finally} block.
 * <p>
 * Work handed to another thread (for example the audit writer) does not inherit the
 * context; capture what is needed at hand-off time or use
 * {@link #runWithContext(RequestContext, Runnable)}.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
        // utility class
    }

    /**
     * Sets the request context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's request context, if set.
     */
    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the current correlation ID, or {@code null} outside a request.
     */
    public static String currentCorrelationId() {
        RequestContext context = CONTEXT.get();
        return context != null ? context.correlationId() : null;
    }

    /**
     * Clears the request context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code runnable} with the given context set, then restores the previous context
     * (or clears it if there was none).
     */
    public static void runWithContext(RequestContext context, Runnable runnable) {
        RequestContext previous = CONTEXT.get();
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

    private static void populateMdc(RequestContext ctx) {
        setMdc(RequestContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(RequestContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(RequestContext.MDC_PRINCIPAL_ID, ctx.principalId());
        setMdc(RequestContext.MDC_ROLE, ctx.role());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(RequestContext.MDC_CORRELATION_ID);
        MDC.remove(RequestContext.MDC_TENANT_ID);
        MDC.remove(RequestContext.MDC_PRINCIPAL_ID);
        MDC.remove(RequestContext.MDC_ROLE);
    }
}
