package com.al.clinicalsummary.service;

import com.al.clinicalsummary.config.ExtractionProperties;
import com.al.clinicalsummary.exception.AssemblyException;
import com.al.clinicalsummary.model.ClinicalSummary;
import com.al.clinicalsummary.model.CorrelationId;
import com.al.clinicalsummary.model.EntityKind;
import com.al.clinicalsummary.model.ExtractionOutcomes;
import com.al.clinicalsummary.model.HospitalSummary;
import com.al.clinicalsummary.model.clinical.AssessmentData;
import com.al.clinicalsummary.model.clinical.CourseData;
import com.al.clinicalsummary.model.clinical.FindingsData;
import com.al.clinicalsummary.model.clinical.FollowUpData;
import com.al.clinicalsummary.model.clinical.HistoryData;
import com.al.clinicalsummary.model.clinical.LabTest;
import com.al.clinicalsummary.model.clinical.LabsData;
import com.al.clinicalsummary.model.clinical.PresentationData;
import com.al.clinicalsummary.model.clinical.TreatmentsData;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.al.clinicalsummary.model.hospital.DiagnosisData;
import com.al.clinicalsummary.model.hospital.FacilityTimingData;
import com.al.clinicalsummary.model.hospital.MedicationRiskData;
import com.al.clinicalsummary.model.hospital.TimingData;
import com.al.clinicalsummary.util.DateTimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Groups entity outcomes into the two aggregates.
 *
 * <p>
 * Clinical sections are optional one by one: a failed kind leaves its section null and
 * assembly always succeeds. Hospital sections are all mandatory: any failed hospital kind, or
 * timing dates that cannot be parsed, fails the whole hospital summary.
 */
@Service
@Slf4j
public class SummaryAssembler {

    private final ExtractionProperties properties;
    private final Clock clock;

    @Autowired
    public SummaryAssembler(ExtractionProperties properties) {
        this(properties, Clock.systemUTC());
    }

    SummaryAssembler(ExtractionProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public AssembledSummaries assemble(ExtractionOutcomes outcomes, CorrelationId correlationId, String patientId) {
        ClinicalSummary clinical = assembleClinical(outcomes, correlationId, patientId);
        try {
            HospitalSummary hospital = assembleHospital(outcomes, correlationId, patientId);
            return AssembledSummaries.of(clinical, hospital);
        } catch (AssemblyException e) {
            log.warn("Hospital summary for hospitalization {} not assembled: {}", correlationId, e.getMessage());
            return AssembledSummaries.withHospitalFailure(clinical, e);
        }
    }

    public ClinicalSummary assembleClinical(ExtractionOutcomes outcomes, CorrelationId correlationId,
            String patientId) {
        ClinicalSummary summary = ClinicalSummary.builder()
                .correlationId(correlationId)
                .patientId(patientId)
                .presentation(outcomes.payloadOrNull(EntityKind.PRESENTATION, PresentationData.class))
                .history(outcomes.payloadOrNull(EntityKind.HISTORY, HistoryData.class))
                .findings(outcomes.payloadOrNull(EntityKind.FINDINGS, FindingsData.class))
                .assessment(outcomes.payloadOrNull(EntityKind.ASSESSMENT, AssessmentData.class))
                .course(outcomes.payloadOrNull(EntityKind.COURSE, CourseData.class))
                .followUp(outcomes.payloadOrNull(EntityKind.FOLLOW_UP, FollowUpData.class))
                .treatments(outcomes.payloadOrNull(EntityKind.TREATMENTS, TreatmentsData.class))
                .labs(ensureLabSummary(outcomes.payloadOrNull(EntityKind.LABS, LabsData.class)))
                .parsedAt(clock.instant())
                .parsingModelVersion(properties.getLlm().getModelName())
                .build();

        List<EntityKind> missing = summary.getMissingSections();
        if (!missing.isEmpty()) {
            log.info("Clinical summary for hospitalization {} assembled without {}", correlationId, missing);
        }
        return summary;
    }

    public HospitalSummary assembleHospital(ExtractionOutcomes outcomes, CorrelationId correlationId,
            String patientId) throws AssemblyException {
        List<EntityKind> failed = outcomes.unsuccessful(EntityKind.forGroup(SummaryGroup.HOSPITAL));
        if (!failed.isEmpty()) {
            throw AssemblyException.missing(SummaryGroup.HOSPITAL, failed);
        }

        FacilityTimingData facilityTiming = outcomes.payloadOrNull(EntityKind.FACILITY_TIMING, FacilityTimingData.class);
        if (facilityTiming.getFacility() == null || facilityTiming.getTiming() == null) {
            throw new AssemblyException(SummaryGroup.HOSPITAL, List.of(EntityKind.FACILITY_TIMING),
                    "facility_timing payload is missing facility or timing");
        }
        DiagnosisData diagnosis = outcomes.payloadOrNull(EntityKind.DIAGNOSIS, DiagnosisData.class);
        MedicationRiskData risk = outcomes.payloadOrNull(EntityKind.MEDICATION_RISK, MedicationRiskData.class);

        TimingData timing = facilityTiming.getTiming();
        int lengthOfStay;
        try {
            lengthOfStay = DateTimeUtil.lengthOfStayDays(timing.getAdmissionDate(), timing.getDischargeDate());
        } catch (DateTimeParseException e) {
            throw new AssemblyException(SummaryGroup.HOSPITAL, List.of(EntityKind.FACILITY_TIMING),
                    "malformed timing dates (admission '" + timing.getAdmissionDate() + "', discharge '"
                            + timing.getDischargeDate() + "'): " + e.getMessage(),
                    e);
        }

        if (risk.getAssessedAt() == null) {
            // payloads belong to the outcomes; defaults go on a copy
            risk = risk.toBuilder().assessedAt(clock.instant()).build();
        }

        return HospitalSummary.builder()
                .correlationId(correlationId)
                .patientId(patientId)
                .facility(facilityTiming.getFacility())
                .timing(timing)
                .diagnosis(diagnosis)
                .medicationRiskAssessment(risk)
                .lengthOfStayDays(lengthOfStay)
                .build();
    }

    /**
     * Recompute lab counts when the extractor left them empty but did report results.
     */
    LabsData ensureLabSummary(LabsData labs) {
        if (labs == null) {
            return null;
        }
        List<LabTest> results = labs.getLabResults();
        if (results == null || results.isEmpty()) {
            return labs;
        }
        LabsData.LabSummary existing = labs.getLabSummary();
        if (existing != null && existing.getTotalTests() > 0) {
            return labs;
        }

        int critical = 0;
        int abnormal = 0;
        for (LabTest test : results) {
            if (test.getStatus() == LabTest.LabStatus.CRITICAL) {
                critical++;
            } else if (test.getStatus() != null && test.getStatus().isAbnormal()) {
                abnormal++;
            }
        }
        return labs.toBuilder()
                .labSummary(LabsData.LabSummary.builder()
                        .totalTests(results.size())
                        .criticalCount(critical)
                        .abnormalCount(abnormal)
                        .normalCount(results.size() - critical - abnormal)
                        .build())
                .build();
    }
}
