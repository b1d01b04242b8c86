package com.tempora.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that runs a store operation inside an
 * {@code INTERNAL} span and tags it with the current {@link WriteContext}.
 *
 * <p>Does not configure the SDK. With {@link #noop()} the spans are discarded, which is the
 * default for embedded use of the store.
 */
public final class OperationTracer {

    /** Instrumentation scope name used when the tracer is obtained from an OpenTelemetry instance. */
    public static final String INSTRUMENTATION_NAME = "com.tempora.versioning";

    private final Tracer tracer;

    /**
     * Creates an OperationTracer backed by the given OTel tracer.
     *
     * @throws IllegalArgumentException if tracer is null
     */
    public OperationTracer(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /** Creates a tracer from an OpenTelemetry instance using {@link #INSTRUMENTATION_NAME}. */
    public static OperationTracer from(OpenTelemetry openTelemetry) {
        return new OperationTracer(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }

    /** A tracer whose spans are never recorded. */
    public static OperationTracer noop() {
        return from(OpenTelemetry.noop());
    }

    /**
     * Runs {@code work} inside a span named {@code operation}. Runtime exceptions are recorded on
     * the span and rethrown unchanged.
     *
     * @param operation span name (e.g. "tempora.write")
     * @param attributes extra span attributes
     * @param work the operation to run
     */
    public <T> T trace(String operation, Map<String, String> attributes, Supplier<T> work) {
        SpanBuilder builder = tracer.spanBuilder(operation).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        WriteContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.tenantId() != null) {
                span.setAttribute("tenant.id", ctx.tenantId());
            }
            if (ctx.entityType() != null) {
                span.setAttribute("entity.type", ctx.entityType());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Returns the underlying OTel tracer. */
    public Tracer tracer() {
        return tracer;
    }
}
