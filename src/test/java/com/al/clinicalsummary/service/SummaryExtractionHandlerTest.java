package com.al.clinicalsummary.service;

import com.al.clinicalsummary.TestPayloads;
import com.al.clinicalsummary.config.ExtractionProperties;
import com.al.clinicalsummary.dto.ExtractionReport;
import com.al.clinicalsummary.exception.DuplicateProcessingException;
import com.al.clinicalsummary.exception.PersistenceException;
import com.al.clinicalsummary.model.ClinicalDocument;
import com.al.clinicalsummary.model.ClinicalSummary;
import com.al.clinicalsummary.model.EntityKind;
import com.al.clinicalsummary.model.EntityOutcome;
import com.al.clinicalsummary.model.HospitalSummary;
import com.al.clinicalsummary.model.enums.PersistenceStatus;
import com.al.clinicalsummary.model.enums.ProcessingStatus;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.al.clinicalsummary.repository.SummaryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class SummaryExtractionHandlerTest {

    @Mock
    private ParallelExtractionOrchestrator orchestrator;

    @Mock
    private SummaryStore<ClinicalSummary> clinicalStore;

    @Mock
    private SummaryStore<HospitalSummary> hospitalStore;

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private SummaryExtractionHandler handler;

    @BeforeEach
    public void setup() throws Exception {
        MockitoAnnotations.openMocks(this);
        executor = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        ExtractionProperties properties = new ExtractionProperties();
        properties.setPersistenceTimeout(Duration.ofSeconds(2));

        PersistenceCoordinator coordinator = new PersistenceCoordinator(clinicalStore, hospitalStore, executor,
                properties, meterRegistry);
        handler = new SummaryExtractionHandler(new CorrelationIdAllocator(), orchestrator,
                new SummaryAssembler(properties), coordinator, meterRegistry);

        when(clinicalStore.upsert(any(), any())).thenReturn("c-1");
        when(hospitalStore.upsert(any(), any())).thenReturn("h-1");
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    private static ClinicalDocument document(String hospitalizationId) {
        return ClinicalDocument.builder()
                .text("Patient admitted with hypoglycemia.")
                .patientId("P-1")
                .hospitalizationId(hospitalizationId)
                .source("test")
                .build();
    }

    @Test
    public void testProcess_Success() {
        when(orchestrator.run(any(), any())).thenReturn(TestPayloads.outcomes());

        ExtractionReport report = handler.process(document("H-1"));

        assertEquals(ProcessingStatus.SUCCESS, report.getStatus());
        assertEquals("H-1", report.getHospitalizationId());
        assertEquals("clinical summary saved, hospital summary saved", report.getMessage());
        assertEquals(11, report.getEntities().size());
        assertFalse(handler.isProcessing("H-1"));
        assertEquals(1, meterRegistry.find("extraction.document.duration").tag("status", "SUCCESS").timer().count());
    }

    @Test
    public void testProcess_PartialWhenDiagnosisMissing() throws Exception {
        when(orchestrator.run(any(), any())).thenReturn(
                TestPayloads.outcomes(EntityOutcome.failed(EntityKind.DIAGNOSIS, "invalid JSON", 2)));

        ExtractionReport report = handler.process(document("H-2"));

        assertEquals(ProcessingStatus.PARTIAL, report.getStatus());
        assertEquals("clinical summary saved, hospital summary failed: missing diagnosis", report.getMessage());
        assertEquals(PersistenceStatus.ASSEMBLY_FAILED, report.getHospital().getStatus());
        verify(hospitalStore, never()).upsert(any(), any());
    }

    @Test
    public void testProcess_FailedWhenNeitherSummaryStored() throws Exception {
        when(orchestrator.run(any(), any())).thenReturn(TestPayloads.outcomes());
        when(clinicalStore.upsert(any(), any())).thenThrow(
                new PersistenceException(SummaryGroup.CLINICAL, "clinical summary write failed: down", null));
        when(hospitalStore.upsert(any(), any())).thenThrow(
                new PersistenceException(SummaryGroup.HOSPITAL, "hospital summary write failed: down", null));

        ExtractionReport report = handler.process(document("H-3"));

        assertEquals(ProcessingStatus.FAILED, report.getStatus());
        assertFalse(report.getClinical().isPersisted());
        assertFalse(report.getHospital().isPersisted());
    }

    @Test
    public void testProcess_GeneratesIdWhenMissing() {
        when(orchestrator.run(any(), any())).thenReturn(TestPayloads.outcomes());

        ExtractionReport report = handler.process(document(null));

        assertNotNull(report.getHospitalizationId());
        assertEquals(36, report.getHospitalizationId().length());
    }

    @Test
    public void testProcess_DuplicateInFlightIdRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(orchestrator.run(any(), any())).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return TestPayloads.outcomes();
        });

        CompletableFuture<ExtractionReport> first = CompletableFuture.supplyAsync(() -> handler.process(document("H-4")));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertTrue(handler.isProcessing("H-4"));
        assertThrows(DuplicateProcessingException.class, () -> handler.process(document("H-4")));

        release.countDown();
        assertEquals(ProcessingStatus.SUCCESS, first.get(5, TimeUnit.SECONDS).getStatus());
        assertFalse(handler.isProcessing("H-4"));
    }

    @Test
    public void testProcess_CancelledDuringExtractionSkipsPersistence() throws Exception {
        when(orchestrator.run(any(), any())).thenAnswer(inv -> {
            assertTrue(handler.cancel("H-5"));
            return TestPayloads.outcomes();
        });

        ExtractionReport report = handler.process(document("H-5"));

        assertEquals(ProcessingStatus.CANCELLED, report.getStatus());
        assertEquals(PersistenceStatus.CANCELLED, report.getClinical().getStatus());
        verify(clinicalStore, never()).upsert(any(), any());
        verify(hospitalStore, never()).upsert(any(), any());
    }

    @Test
    public void testCancel_UnknownIdReturnsFalse() {
        assertFalse(handler.cancel("nothing-running"));
    }

    @Test
    public void testProcess_RestoresCallerMdc() {
        when(orchestrator.run(any(), any())).thenAnswer(inv -> {
            assertEquals("H-6", MDC.get("correlationId"));
            return TestPayloads.outcomes();
        });
        MDC.put("correlationId", "request-123");

        handler.process(document("H-6"));

        assertEquals("request-123", MDC.get("correlationId"));
    }
}
