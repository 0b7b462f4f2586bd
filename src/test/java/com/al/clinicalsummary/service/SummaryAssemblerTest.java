package com.al.clinicalsummary.service;

import com.al.clinicalsummary.TestPayloads;
import com.al.clinicalsummary.config.ExtractionProperties;
import com.al.clinicalsummary.exception.AssemblyException;
import com.al.clinicalsummary.model.ClinicalSummary;
import com.al.clinicalsummary.model.CorrelationId;
import com.al.clinicalsummary.model.EntityKind;
import com.al.clinicalsummary.model.EntityOutcome;
import com.al.clinicalsummary.model.ExtractionOutcomes;
import com.al.clinicalsummary.model.HospitalSummary;
import com.al.clinicalsummary.model.clinical.LabTest;
import com.al.clinicalsummary.model.clinical.LabsData;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.al.clinicalsummary.model.hospital.MedicationRiskData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SummaryAssemblerTest {

    private static final Instant NOW = Instant.parse("2025-01-06T08:00:00Z");
    private static final CorrelationId ID = CorrelationId.supplied("H-1");

    private SummaryAssembler assembler;

    @BeforeEach
    public void setup() {
        assembler = new SummaryAssembler(new ExtractionProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    public void testAssemble_AllSucceeded() {
        AssembledSummaries result = assembler.assemble(TestPayloads.outcomes(), ID, "P-1");

        assertTrue(result.isHospitalAssembled());
        assertNull(result.getHospitalFailure());

        HospitalSummary hospital = result.getHospital();
        assertEquals(4, hospital.getLengthOfStayDays());
        assertEquals("General Hospital", hospital.getFacility().getFacilityName());
        assertEquals("Hypoglycemia", hospital.getDiagnosis().getPrimaryDiagnosis());
        assertEquals(ID, hospital.getCorrelationId());
        assertEquals(NOW, hospital.getMedicationRiskAssessment().getAssessedAt());

        ClinicalSummary clinical = result.getClinical();
        assertTrue(clinical.getMissingSections().isEmpty());
        assertEquals(NOW, clinical.getParsedAt());
        assertEquals("gpt-4o-mini", clinical.getParsingModelVersion());
        assertEquals("P-1", clinical.getPatientId());
    }

    @Test
    public void testAssemble_MissingDiagnosisFailsHospitalOnly() {
        AssembledSummaries result = assembler.assemble(
                TestPayloads.outcomes(EntityOutcome.failed(EntityKind.DIAGNOSIS, "bad JSON", 3)), ID, "P-1");

        assertFalse(result.isHospitalAssembled());
        AssemblyException failure = result.getHospitalFailure();
        assertEquals(SummaryGroup.HOSPITAL, failure.getGroup());
        assertEquals(List.of(EntityKind.DIAGNOSIS), failure.getFailedKinds());
        assertEquals("missing diagnosis", failure.getMessage());
        assertTrue(result.getClinical().getMissingSections().isEmpty());
    }

    @Test
    public void testAssembleHospital_ListsEveryFailedKind() {
        AssemblyException e = assertThrows(AssemblyException.class, () -> assembler.assembleHospital(
                TestPayloads.outcomes(
                        EntityOutcome.timedOut(EntityKind.FACILITY_TIMING, Duration.ofSeconds(180), 180_000),
                        EntityOutcome.failed(EntityKind.MEDICATION_RISK, "invalid", 4)),
                ID, "P-1"));

        assertEquals(List.of(EntityKind.FACILITY_TIMING, EntityKind.MEDICATION_RISK), e.getFailedKinds());
        assertEquals("missing facility_timing, medication_risk", e.getMessage());
    }

    @Test
    public void testAssembleHospital_MalformedDateNamesFacilityTiming() {
        AssemblyException e = assertThrows(AssemblyException.class, () -> assembler.assembleHospital(
                TestPayloads.outcomes(EntityOutcome.success(EntityKind.FACILITY_TIMING,
                        TestPayloads.facilityTiming("not-a-date", "2025-01-05"), 2)),
                ID, "P-1"));

        assertEquals(List.of(EntityKind.FACILITY_TIMING), e.getFailedKinds());
        assertTrue(e.getMessage().contains("not-a-date"));
    }

    @Test
    public void testAssembleHospital_DischargeBeforeAdmissionClampsToZero() throws Exception {
        HospitalSummary hospital = assembler.assembleHospital(
                TestPayloads.outcomes(EntityOutcome.success(EntityKind.FACILITY_TIMING,
                        TestPayloads.facilityTiming("2025-01-05", "2025-01-01"), 2)),
                ID, "P-1");

        assertEquals(0, hospital.getLengthOfStayDays());
    }

    @Test
    public void testAssembleHospital_KeepsExtractedAssessedAt() throws Exception {
        Instant assessed = Instant.parse("2025-01-05T12:00:00Z");
        MedicationRiskData risk = (MedicationRiskData) TestPayloads.payloadFor(EntityKind.MEDICATION_RISK);
        risk.setAssessedAt(assessed);

        HospitalSummary hospital = assembler.assembleHospital(
                TestPayloads.outcomes(EntityOutcome.success(EntityKind.MEDICATION_RISK, risk, 2)), ID, "P-1");

        assertEquals(assessed, hospital.getMedicationRiskAssessment().getAssessedAt());
    }

    @Test
    public void testAssemble_DefaultsDoNotChangeExtractedPayloads() {
        ExtractionOutcomes outcomes = TestPayloads.outcomes();

        AssembledSummaries result = assembler.assemble(outcomes, ID, "P-1");

        assertEquals(NOW, result.getHospital().getMedicationRiskAssessment().getAssessedAt());
        assertEquals(3, result.getClinical().getLabs().getLabSummary().getTotalTests());

        MedicationRiskData extractedRisk = (MedicationRiskData) outcomes.get(EntityKind.MEDICATION_RISK).getPayload();
        LabsData extractedLabs = (LabsData) outcomes.get(EntityKind.LABS).getPayload();
        assertNull(extractedRisk.getAssessedAt());
        assertNull(extractedLabs.getLabSummary());

        // assembling again over the same outcomes gives the same result
        AssembledSummaries again = assembler.assemble(outcomes, ID, "P-1");
        assertEquals(result.getHospital().getMedicationRiskAssessment(), again.getHospital().getMedicationRiskAssessment());
        assertEquals(result.getClinical().getLabs(), again.getClinical().getLabs());
    }

    @Test
    public void testAssembleClinical_FailedKindsLeaveNullSections() {
        ClinicalSummary clinical = assembler.assembleClinical(TestPayloads.outcomes(
                EntityOutcome.failed(EntityKind.HISTORY, "bad", 1),
                EntityOutcome.timedOut(EntityKind.LABS, Duration.ofSeconds(1), 1000)), ID, "P-1");

        assertNull(clinical.getHistory());
        assertNull(clinical.getLabs());
        assertNotNull(clinical.getPresentation());
        assertEquals(List.of(EntityKind.HISTORY, EntityKind.LABS), clinical.getMissingSections());
    }

    @Test
    public void testAssembleClinical_EverythingFailedStillAssembles() {
        List<EntityOutcome> failures = new ArrayList<>();
        for (EntityKind kind : EntityKind.values()) {
            failures.add(EntityOutcome.failed(kind, "down", 1));
        }

        AssembledSummaries result = assembler.assemble(
                TestPayloads.outcomes(failures.toArray(new EntityOutcome[0])), ID, "P-1");

        assertEquals(8, result.getClinical().getMissingSections().size());
        assertFalse(result.isHospitalAssembled());
        assertEquals(3, result.getHospitalFailure().getFailedKinds().size());
    }

    @Test
    public void testEnsureLabSummary_ComputesCountsWhenMissing() {
        LabsData labs = (LabsData) TestPayloads.payloadFor(EntityKind.LABS);

        LabsData.LabSummary summary = assembler.ensureLabSummary(labs).getLabSummary();

        assertEquals(3, summary.getTotalTests());
        assertEquals(1, summary.getCriticalCount());
        assertEquals(1, summary.getAbnormalCount());
        assertEquals(1, summary.getNormalCount());
    }

    @Test
    public void testEnsureLabSummary_KeepsReportedCounts() {
        LabsData labs = LabsData.builder()
                .labResults(new ArrayList<>(List.of(TestPayloads.lab("Glucose", 38, LabTest.LabStatus.CRITICAL))))
                .labSummary(LabsData.LabSummary.builder().totalTests(5).criticalCount(2).build())
                .build();

        assertEquals(5, assembler.ensureLabSummary(labs).getLabSummary().getTotalTests());
    }
}
