package com.docgate.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link CorrelationContext}, mirrored into the SLF4J MDC.
 * <p>
 * Gateway operations run on the caller's thread. Work handed to another thread must carry the
 * context explicitly through {@link #callWithContext(CorrelationContext, Supplier)}.
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
        putMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putMdc(CorrelationContext.MDC_TENANT_ID, context.tenantId());
        putMdc(CorrelationContext.MDC_USER_ID, context.userId());
        putMdc(CorrelationContext.MDC_OPERATION, context.operation());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Replaces the tenant of the current context, if one is set.
     */
    public static void updateTenant(String tenantId) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withTenant(tenantId));
        }
    }

    /** Clears the context and its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_OPERATION);
    }

    /**
     * Runs {@code work} with the given context, then restores whatever was set before.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /** Runnable variant of {@link #callWithContext(CorrelationContext, Supplier)}. */
    public static void runWithContext(CorrelationContext context, Runnable work) {
        callWithContext(context, () -> {
            work.run();
            return null;
        });
    }

    private static void putMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
