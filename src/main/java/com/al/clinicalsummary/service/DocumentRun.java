package com.al.clinicalsummary.service;

import com.al.clinicalsummary.model.CorrelationId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation scope for one document. Every extractor and persistence task of the document is
 * submitted through its run, so cancelling the run reaches exactly those tasks and nothing else.
 *
 * <p>
 * A task whose future is completed from outside (timeout or cancellation) before it finished is
 * interrupted, so abandoned extractor calls do not keep a worker busy. Timeouts are armed when the
 * task starts running on a worker; time spent queued behind other documents does not count.
 */
@Slf4j
public class DocumentRun {

    private final CorrelationId correlationId;
    private final Map<CompletableFuture<?>, Future<?>> inFlight = new ConcurrentHashMap<>();
    private volatile boolean cancelled;

    public DocumentRun(CorrelationId correlationId) {
        this.correlationId = correlationId;
    }

    public CorrelationId getCorrelationId() {
        return correlationId;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Run {@code work} on the executor. Exceptions thrown by the work, including ones thrown
     * before it reaches the executor, complete the returned future exceptionally.
     */
    public <T> CompletableFuture<T> submit(ExecutorService executor, Callable<T> work) {
        return submit(executor, null, work);
    }

    /**
     * Like {@link #submit(ExecutorService, Callable)}, but the returned future completes with a
     * {@link java.util.concurrent.TimeoutException} once {@code timeout} has passed since the work
     * started running.
     */
    public <T> CompletableFuture<T> submit(ExecutorService executor, @Nullable Duration timeout, Callable<T> work) {
        CompletableFuture<T> promise = new CompletableFuture<>();
        if (cancelled) {
            promise.completeExceptionally(cancellation());
            return promise;
        }

        AtomicBoolean finished = new AtomicBoolean();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                if (promise.isDone()) {
                    return;
                }
                if (timeout != null) {
                    promise.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                }
                try {
                    T result = work.call();
                    finished.set(true);
                    promise.complete(result);
                } catch (Exception e) {
                    finished.set(true);
                    promise.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            promise.completeExceptionally(e);
            return promise;
        }

        inFlight.put(promise, task);
        promise.whenComplete((result, error) -> {
            inFlight.remove(promise);
            if (!finished.get()) {
                task.cancel(true);
            }
        });

        // cancel() may have run between the check above and registration
        if (cancelled) {
            promise.completeExceptionally(cancellation());
        }
        return promise;
    }

    /**
     * Cancel every in-flight task of this document. Later submissions fail immediately.
     */
    public void cancel() {
        cancelled = true;
        int count = 0;
        for (CompletableFuture<?> promise : new ArrayList<>(inFlight.keySet())) {
            if (promise.completeExceptionally(cancellation())) {
                count++;
            }
        }
        log.info("Cancelled processing of hospitalization {} ({} tasks in flight)", correlationId, count);
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private CancellationException cancellation() {
        return new CancellationException("Processing of hospitalization " + correlationId + " was cancelled");
    }
}
