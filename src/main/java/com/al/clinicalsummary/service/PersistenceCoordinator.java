package com.al.clinicalsummary.service;

import com.al.clinicalsummary.config.ExtractionProperties;
import com.al.clinicalsummary.dto.PersistenceOutcome;
import com.al.clinicalsummary.exception.PersistenceException;
import com.al.clinicalsummary.model.ClinicalSummary;
import com.al.clinicalsummary.model.CorrelationId;
import com.al.clinicalsummary.model.HospitalSummary;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.al.clinicalsummary.repository.SummaryStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Writes both aggregates concurrently. The writes share no transaction and no lock; one failing
 * never affects the other. A hospital summary that failed assembly is never written: its
 * assembly failure becomes the hospital outcome with no store call made.
 */
@Service
@Slf4j
public class PersistenceCoordinator {

    private final SummaryStore<ClinicalSummary> clinicalStore;
    private final SummaryStore<HospitalSummary> hospitalStore;
    private final ExecutorService executorService;
    private final ExtractionProperties properties;
    private final MeterRegistry meterRegistry;

    @Autowired
    public PersistenceCoordinator(SummaryStore<ClinicalSummary> clinicalStore,
            SummaryStore<HospitalSummary> hospitalStore,
            @Qualifier("extractionExecutor") ExecutorService executorService,
            ExtractionProperties properties,
            MeterRegistry meterRegistry) {
        this.clinicalStore = clinicalStore;
        this.hospitalStore = hospitalStore;
        this.executorService = executorService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public PersistenceResult persist(AssembledSummaries summaries, CorrelationId correlationId, DocumentRun run) {
        CompletableFuture<PersistenceOutcome> clinical = write(SummaryGroup.CLINICAL, clinicalStore,
                summaries.getClinical(), correlationId, run);

        CompletableFuture<PersistenceOutcome> hospital;
        if (summaries.isHospitalAssembled()) {
            hospital = write(SummaryGroup.HOSPITAL, hospitalStore, summaries.getHospital(), correlationId, run);
        } else {
            log.warn("Skipping hospital summary write for hospitalization {}: {}", correlationId,
                    summaries.getHospitalFailure().getMessage());
            hospital = CompletableFuture.completedFuture(
                    record(PersistenceOutcome.assemblyFailed(summaries.getHospitalFailure())));
        }

        CompletableFuture.allOf(clinical, hospital).join();
        PersistenceResult result = new PersistenceResult(clinical.join(), hospital.join());
        log.info("Persistence completed for hospitalization {}: clinical={}, hospital={}", correlationId,
                result.getClinical().getStatus(), result.getHospital().getStatus());
        return result;
    }

    private <T> CompletableFuture<PersistenceOutcome> write(SummaryGroup group, SummaryStore<T> store, T summary,
            CorrelationId correlationId, DocumentRun run) {
        Duration timeout = properties.getPersistenceTimeout();
        CompletableFuture<String> call = run.submit(executorService, timeout,
                () -> store.upsert(correlationId, summary));
        return call.handle((recordId, error) -> record(toOutcome(group, correlationId, recordId, error, timeout)));
    }

    private PersistenceOutcome toOutcome(SummaryGroup group, CorrelationId correlationId, String recordId,
            Throwable error, Duration timeout) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause == null) {
            log.info("Saved {} {} for hospitalization {}", group.getLabel(), recordId, correlationId);
            return PersistenceOutcome.persisted(group, recordId);
        }
        if (cause instanceof CancellationException) {
            return PersistenceOutcome.cancelled(group);
        }
        if (cause instanceof TimeoutException) {
            log.error("{} write for hospitalization {} timed out after {}ms, it may still have been stored",
                    group.getLabel(), correlationId, timeout.toMillis());
            return PersistenceOutcome.failed(group, "write timed out after " + timeout.toMillis()
                    + "ms, outcome unknown: the record may have been stored");
        }
        if (cause instanceof PersistenceException) {
            log.error("{} write for hospitalization {} failed: {}", group.getLabel(), correlationId,
                    cause.getMessage(), cause);
            return PersistenceOutcome.failed(group, cause.getMessage());
        }
        log.error("Unexpected error writing {} for hospitalization {}", group.getLabel(), correlationId, cause);
        return PersistenceOutcome.failed(group, "unexpected error: " + cause.getMessage());
    }

    private PersistenceOutcome record(PersistenceOutcome outcome) {
        meterRegistry.counter("extraction.persistence",
                "aggregate", outcome.getAggregate().name().toLowerCase(),
                "status", outcome.getStatus().name().toLowerCase()).increment();
        return outcome;
    }
}
