/**
 * Observability support for the versioning store.
 *
 * <ul>
 *   <li>{@link com.tempora.observability.WriteContextHolder}: thread-local operation context
 *       mirrored into the SLF4J MDC
 *   <li>{@link com.tempora.observability.MetricFactory}: Micrometer meters with service and
 *       tenant tags
 *   <li>{@link com.tempora.observability.OperationTracer}: OpenTelemetry spans around store
 *       operations
 *   <li>{@link com.tempora.observability.SensitiveDataRedactor}: attribute-level redaction of
 *       JSON payloads
 * </ul>
 */
package com.tempora.observability;
