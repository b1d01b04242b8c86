package com.tempora.versioning.audit;

import com.tempora.changeevents.ChangeEvent;
import com.tempora.changeevents.ChangeEventValidator;
import com.tempora.changeevents.ValidationResult;
import com.tempora.versioning.metrics.VersioningMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best-effort side channel from the write path to an {@link AuditSink}.
 *
 * <p>Events are handed to a small bounded pool and the writer returns immediately. Each delivery is
 * bounded by {@code timeout}. A sink exception, a timeout or a full queue is logged with the
 * event's context and counted in {@code tempora.audit.failures}; none of them is ever propagated.
 * An event that fails {@link ChangeEventValidator} is counted the same way and never reaches the
 * sink.
 *
 * <p>A delivery that outlives the timeout is cancelled and its pool thread interrupted. A sink that
 * ignores interruption still holds that thread until it returns.
 */
public final class AuditBridge {

    private static final Logger log = LoggerFactory.getLogger(AuditBridge.class);

    private final AuditSink sink;
    private final Duration timeout;
    private final ExecutorService executor;
    private final VersioningMetrics metrics;

    public AuditBridge(AuditSink sink, Duration timeout, ExecutorService executor, VersioningMetrics metrics) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.sink = sink;
        this.timeout = timeout;
        this.executor = executor;
        this.metrics = metrics;
    }

    /** Creates a bridge with its own daemon pool of {@code threads} and a queue of {@code queueCapacity}. */
    public static AuditBridge create(
            AuditSink sink, Duration timeout, int threads, int queueCapacity, VersioningMetrics metrics) {
        ExecutorService executor = new ThreadPoolExecutor(
                threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                daemonThreads(),
                new ThreadPoolExecutor.AbortPolicy());
        log.info("Audit bridge started with sink {} in {} mode", sink.name(), sink.mode());
        return new AuditBridge(sink, timeout, executor, metrics);
    }

    /** Hands the event to the sink without waiting for delivery. */
    public void notifyChange(ChangeEvent event) {
        dispatch(event);
    }

    /**
     * Hands the event to the sink.
     *
     * @return completes with true once delivered, false if delivery failed or timed out; never
     *     completes exceptionally
     */
    public CompletableFuture<Boolean> dispatch(ChangeEvent event) {
        ValidationResult validation = ChangeEventValidator.validate(event);
        if (!validation.valid()) {
            recordFailure(event, new IllegalArgumentException("Invalid change event: " + validation.summary()));
            return CompletableFuture.completedFuture(false);
        }

        CompletableFuture<Void> delivery = new CompletableFuture<>();
        Future<?> task;
        try {
            task = executor.submit(() -> deliver(event, delivery));
        } catch (RejectedExecutionException e) {
            recordFailure(event, e);
            return CompletableFuture.completedFuture(false);
        }
        return delivery
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error != null) {
                        task.cancel(true);
                        recordFailure(event, unwrap(error));
                        return false;
                    }
                    return true;
                });
    }

    public SinkMode mode() {
        return sink.mode();
    }

    public AuditSink sink() {
        return sink;
    }

    /** Stops accepting events and waits up to the delivery timeout for queued ones. */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Audit bridge shut down with {} undelivered events",
                        executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void deliver(ChangeEvent event, CompletableFuture<Void> delivery) {
        try {
            sink.publish(event);
            delivery.complete(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            delivery.completeExceptionally(e);
        } catch (Exception e) {
            delivery.completeExceptionally(e);
        }
    }

    private void recordFailure(ChangeEvent event, Throwable error) {
        metrics.recordAuditFailure();
        log.warn("Audit sink {} failed for event {} ({} {}/{}/{} version {} -> {}, actor {}, correlation {})",
                sink.name(), event.eventId(), event.changeType(), event.tenantId(), event.entityType(),
                event.businessKey(), event.oldVersionSeq(), event.newVersionSeq(), event.actor(),
                event.correlationId(), error);
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "tempora-audit-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
