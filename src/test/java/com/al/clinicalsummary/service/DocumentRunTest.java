package com.al.clinicalsummary.service;

import com.al.clinicalsummary.model.CorrelationId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentRunTest {

    private ExecutorService executor;
    private DocumentRun run;

    @BeforeEach
    public void setup() {
        executor = Executors.newFixedThreadPool(4);
        run = new DocumentRun(CorrelationId.supplied("H-100"));
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testSubmit_ReturnsResult() throws Exception {
        assertEquals("done", run.submit(executor, () -> "done").get(1, TimeUnit.SECONDS));
    }

    @Test
    public void testSubmit_CheckedExceptionCompletesExceptionally() {
        CompletableFuture<String> future = run.submit(executor, () -> {
            throw new IOException("disk gone");
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    public void testCancel_InterruptsInFlightTask() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        CompletableFuture<String> future = run.submit(executor, () -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        });
        assertTrue(started.await(1, TimeUnit.SECONDS));

        run.cancel();

        assertTrue(run.isCancelled());
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof CancellationException);
        assertTrue(interrupted.await(1, TimeUnit.SECONDS));
    }

    @Test
    public void testSubmit_AfterCancelNeverRuns() {
        run.cancel();
        AtomicBoolean ran = new AtomicBoolean();

        CompletableFuture<String> future = run.submit(executor, () -> {
            ran.set(true);
            return "ran";
        });

        assertTrue(future.isCompletedExceptionally());
        assertFalse(ran.get());
    }

    @Test
    public void testTimeout_StartsWhenTaskRuns() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            CountDownLatch busy = new CountDownLatch(1);
            single.submit(() -> {
                busy.countDown();
                Thread.sleep(400);
                return null;
            });
            assertTrue(busy.await(1, TimeUnit.SECONDS));

            // queued for ~400ms behind the busy worker, well past its 200ms budget
            CompletableFuture<String> future = run.submit(single, Duration.ofMillis(200), () -> "done");

            assertEquals("done", future.get(2, TimeUnit.SECONDS));
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    public void testTimeout_BoundsRunningTask() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        CompletableFuture<String> future = run.submit(executor, Duration.ofMillis(100), () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof TimeoutException);
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void testTimeout_InterruptsAbandonedTask() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        CompletableFuture<String> future = run.submit(executor, () -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        }).orTimeout(100, TimeUnit.MILLISECONDS);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof TimeoutException);
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    public void testCancel_DoesNotAffectOtherRuns() throws Exception {
        DocumentRun other = new DocumentRun(CorrelationId.supplied("H-200"));
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> otherFuture = other.submit(executor, () -> {
            release.await(2, TimeUnit.SECONDS);
            return "other";
        });

        run.cancel();
        release.countDown();

        assertFalse(other.isCancelled());
        assertEquals("other", otherFuture.get(2, TimeUnit.SECONDS));
    }
}
