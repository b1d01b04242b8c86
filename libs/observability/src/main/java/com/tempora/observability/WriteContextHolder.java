package com.tempora.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Thread-local holder for {@link WriteContext} with SLF4J MDC bridge.
 *
 * <p>While a context is set, the MDC carries its correlation ID, tenant, actor, entity type and
 * business key. Contexts nest: {@link #callWithContext} restores whatever was set before.
 */
public final class WriteContextHolder {

    private static final ThreadLocal<WriteContext> CONTEXT = new ThreadLocal<>();

    private WriteContextHolder() {
        // Utility class, no instantiation
    }

    /**
     * Sets the context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(WriteContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's context, if set. */
    public static Optional<WriteContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the correlation ID of the current context, or a freshly generated one when no context
     * is set.
     */
    public static String currentOrNewCorrelationId() {
        WriteContext ctx = CONTEXT.get();
        return ctx != null ? ctx.correlationId() : UUID.randomUUID().toString();
    }

    /** Clears the context and removes all MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Executes {@code work} with the given context set, then restores the previous context (or
     * clears if there was none).
     */
    public static <T> T callWithContext(WriteContext context, Supplier<T> work) {
        WriteContext previous = CONTEXT.get();
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

    private static void populateMdc(WriteContext ctx) {
        setMdc(WriteContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(WriteContext.MDC_TENANT_ID, ctx.tenantId());
        setMdc(WriteContext.MDC_ACTOR, ctx.actor());
        setMdc(WriteContext.MDC_ENTITY_TYPE, ctx.entityType());
        setMdc(WriteContext.MDC_BUSINESS_KEY, ctx.businessKey());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(WriteContext.MDC_CORRELATION_ID);
        MDC.remove(WriteContext.MDC_TENANT_ID);
        MDC.remove(WriteContext.MDC_ACTOR);
        MDC.remove(WriteContext.MDC_ENTITY_TYPE);
        MDC.remove(WriteContext.MDC_BUSINESS_KEY);
    }
}
