package com.al.clinicalsummary.service;

import com.al.clinicalsummary.dto.EntityOutcomeSummary;
import com.al.clinicalsummary.dto.ExtractionReport;
import com.al.clinicalsummary.dto.PersistenceOutcome;
import com.al.clinicalsummary.exception.DuplicateProcessingException;
import com.al.clinicalsummary.model.ClinicalDocument;
import com.al.clinicalsummary.model.CorrelationId;
import com.al.clinicalsummary.model.ExtractionOutcomes;
import com.al.clinicalsummary.model.enums.ProcessingStatus;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * End-to-end processing of one note: allocate the hospitalization id, extract all entities,
 * assemble both aggregates, persist them, and report a combined status.
 *
 * <p>
 * At most one run per hospitalization id is in flight. Runs for different ids are fully
 * independent and can be cancelled one at a time.
 */
@Service
@Slf4j
public class SummaryExtractionHandler {

    static final String MDC_KEY = "correlationId";

    private final CorrelationIdAllocator correlationIdAllocator;
    private final ParallelExtractionOrchestrator orchestrator;
    private final SummaryAssembler assembler;
    private final PersistenceCoordinator persistenceCoordinator;
    private final MeterRegistry meterRegistry;

    private final ConcurrentMap<String, DocumentRun> activeRuns = new ConcurrentHashMap<>();

    @Autowired
    public SummaryExtractionHandler(CorrelationIdAllocator correlationIdAllocator,
            ParallelExtractionOrchestrator orchestrator,
            SummaryAssembler assembler,
            PersistenceCoordinator persistenceCoordinator,
            MeterRegistry meterRegistry) {
        this.correlationIdAllocator = correlationIdAllocator;
        this.orchestrator = orchestrator;
        this.assembler = assembler;
        this.persistenceCoordinator = persistenceCoordinator;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Process one document synchronously.
     *
     * @throws DuplicateProcessingException if the same hospitalization id is already in flight
     */
    public ExtractionReport process(ClinicalDocument document) {
        CorrelationId correlationId = correlationIdAllocator.allocate(document);
        DocumentRun run = new DocumentRun(correlationId);
        if (activeRuns.putIfAbsent(correlationId.getValue(), run) != null) {
            throw new DuplicateProcessingException(correlationId.getValue());
        }

        String previousMdc = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, correlationId.getValue());
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        try {
            log.info("Processing note for patient {} (hospitalization {}, source {})",
                    document.getPatientId(), correlationId, document.getSource());

            ExtractionOutcomes outcomes = orchestrator.run(document, run);
            ExtractionReport report;
            if (run.isCancelled()) {
                report = cancelledReport(document, correlationId, outcomes);
            } else {
                AssembledSummaries summaries = assembler.assemble(outcomes, correlationId, document.getPatientId());
                PersistenceResult persisted = persistenceCoordinator.persist(summaries, correlationId, run);
                report = buildReport(document, correlationId, outcomes, persisted, run.isCancelled());
            }
            report.setProcessingTimeMs(System.currentTimeMillis() - startTime);

            sample.stop(meterRegistry.timer("extraction.document.duration", "status", report.getStatus().name()));
            log.info("Note for hospitalization {} processed with status {}: {} ({}ms)", correlationId,
                    report.getStatus(), report.getMessage(), report.getProcessingTimeMs());
            return report;
        } finally {
            activeRuns.remove(correlationId.getValue(), run);
            if (previousMdc != null) {
                MDC.put(MDC_KEY, previousMdc);
            } else {
                MDC.remove(MDC_KEY);
            }
        }
    }

    /**
     * Cancel the in-flight run for a hospitalization id. Other runs are unaffected.
     *
     * @return false if nothing is in flight for that id
     */
    public boolean cancel(String hospitalizationId) {
        DocumentRun run = activeRuns.get(hospitalizationId);
        if (run == null) {
            return false;
        }
        run.cancel();
        return true;
    }

    public boolean isProcessing(String hospitalizationId) {
        return activeRuns.containsKey(hospitalizationId);
    }

    private ExtractionReport buildReport(ClinicalDocument document, CorrelationId correlationId,
            ExtractionOutcomes outcomes, PersistenceResult persisted, boolean cancelled) {
        ProcessingStatus status;
        String message;
        if (cancelled) {
            status = ProcessingStatus.CANCELLED;
            message = "processing cancelled: " + persisted.getClinical().describe() + ", "
                    + persisted.getHospital().describe();
        } else {
            switch (persisted.persistedCount()) {
                case 2:
                    status = ProcessingStatus.SUCCESS;
                    break;
                case 1:
                    status = ProcessingStatus.PARTIAL;
                    break;
                default:
                    status = ProcessingStatus.FAILED;
            }
            message = persisted.getClinical().describe() + ", " + persisted.getHospital().describe();
        }

        return ExtractionReport.builder()
                .hospitalizationId(correlationId.getValue())
                .patientId(document.getPatientId())
                .status(status)
                .message(message)
                .clinical(persisted.getClinical())
                .hospital(persisted.getHospital())
                .entities(summarize(outcomes))
                .build();
    }

    private ExtractionReport cancelledReport(ClinicalDocument document, CorrelationId correlationId,
            ExtractionOutcomes outcomes) {
        return ExtractionReport.builder()
                .hospitalizationId(correlationId.getValue())
                .patientId(document.getPatientId())
                .status(ProcessingStatus.CANCELLED)
                .message("processing cancelled before persistence")
                .clinical(PersistenceOutcome.cancelled(SummaryGroup.CLINICAL))
                .hospital(PersistenceOutcome.cancelled(SummaryGroup.HOSPITAL))
                .entities(summarize(outcomes))
                .build();
    }

    private static java.util.List<EntityOutcomeSummary> summarize(ExtractionOutcomes outcomes) {
        return outcomes.all().stream()
                .map(EntityOutcomeSummary::from)
                .collect(Collectors.toList());
    }
}
