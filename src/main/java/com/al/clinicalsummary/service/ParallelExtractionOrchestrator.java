package com.al.clinicalsummary.service;

import com.al.clinicalsummary.config.ExtractionProperties;
import com.al.clinicalsummary.extraction.EntityExtractor;
import com.al.clinicalsummary.extraction.ExtractionRegistry;
import com.al.clinicalsummary.model.ClinicalDocument;
import com.al.clinicalsummary.model.EntityKind;
import com.al.clinicalsummary.model.EntityOutcome;
import com.al.clinicalsummary.model.ExtractionOutcomes;
import com.al.clinicalsummary.model.enums.OutcomeStatus;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs every registered extractor against one document in parallel and waits for all of them.
 *
 * <p>
 * Each call is bounded by the configured extractor timeout. A failing, throwing or stalled
 * extractor only affects its own outcome; siblings are never cancelled and the method returns
 * once every extractor has an outcome. No retries happen here.
 */
@Service
@Slf4j
public class ParallelExtractionOrchestrator {

    private final ExtractionRegistry registry;
    private final ExecutorService executorService;
    private final ExtractionProperties properties;
    private final MeterRegistry meterRegistry;

    @Autowired
    public ParallelExtractionOrchestrator(ExtractionRegistry registry,
            @Qualifier("extractionExecutor") ExecutorService executorService,
            ExtractionProperties properties,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.executorService = executorService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public ExtractionOutcomes run(ClinicalDocument document, DocumentRun run) {
        long startTime = System.currentTimeMillis();
        Duration timeout = properties.getExtractorTimeout();
        String text = document.getText() == null ? "" : document.getText();
        if (text.isBlank()) {
            log.warn("Document for hospitalization {} is empty, extractors are still invoked", run.getCorrelationId());
        }
        log.info("Starting extraction of {} entities for hospitalization {}", registry.size(), run.getCorrelationId());

        List<CompletableFuture<EntityOutcome>> futures = new ArrayList<>();
        for (EntityKind kind : registry.kinds()) {
            futures.add(invoke(kind, registry.get(kind), text, timeout, run));
        }

        // Barrier: every future resolves to an outcome, never exceptionally
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<EntityOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());
        ExtractionOutcomes result = new ExtractionOutcomes(outcomes);

        log.info("Extraction completed for hospitalization {}: {} success, {} failed, {} timed out, {}ms total",
                run.getCorrelationId(),
                result.count(OutcomeStatus.SUCCESS),
                result.count(OutcomeStatus.FAILED),
                result.count(OutcomeStatus.TIMED_OUT),
                System.currentTimeMillis() - startTime);
        return result;
    }

    private CompletableFuture<EntityOutcome> invoke(EntityKind kind, EntityExtractor<?> extractor, String text,
            Duration timeout, DocumentRun run) {
        long start = System.nanoTime();
        CompletableFuture<Object> call = run.submit(executorService, timeout, () -> extractor.extract(text));
        return call.handle((payload, error) -> record(toOutcome(kind, payload, error, timeout, elapsedMs(start))));
    }

    private EntityOutcome toOutcome(EntityKind kind, Object payload, Throwable error, Duration timeout,
            long elapsedMs) {
        Throwable cause = unwrap(error);
        if (cause == null) {
            if (payload == null) {
                log.warn("Extractor {} returned no payload", kind.getWireName());
                return EntityOutcome.failed(kind, "Extractor returned no payload", elapsedMs);
            }
            try {
                return EntityOutcome.success(kind, payload, elapsedMs);
            } catch (IllegalArgumentException e) {
                log.error("Extractor {} returned an unexpected payload: {}", kind.getWireName(), e.getMessage());
                return EntityOutcome.failed(kind, e.getMessage(), elapsedMs);
            }
        }
        if (cause instanceof TimeoutException) {
            log.warn("Extractor {} timed out after {}ms", kind.getWireName(), timeout.toMillis());
            return EntityOutcome.timedOut(kind, timeout, elapsedMs);
        }
        if (cause instanceof CancellationException) {
            return EntityOutcome.failed(kind, "Cancelled", elapsedMs);
        }
        log.error("Extractor {} failed: {}", kind.getWireName(), cause.getMessage());
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return EntityOutcome.failed(kind, message, elapsedMs);
    }

    private EntityOutcome record(EntityOutcome outcome) {
        meterRegistry.counter("extraction.entity.outcome",
                "kind", outcome.getKind().getWireName(),
                "status", outcome.getStatus().getValue()).increment();
        return outcome;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
