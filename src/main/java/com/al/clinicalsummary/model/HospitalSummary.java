package com.al.clinicalsummary.model;

import com.al.clinicalsummary.model.hospital.DiagnosisData;
import com.al.clinicalsummary.model.hospital.FacilityData;
import com.al.clinicalsummary.model.hospital.MedicationRiskData;
import com.al.clinicalsummary.model.hospital.TimingData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hospital admission aggregate. Only ever built complete: all four sections are non-null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HospitalSummary {

    private CorrelationId correlationId;
    private String patientId;

    private FacilityData facility;
    private TimingData timing;
    private DiagnosisData diagnosis;
    private MedicationRiskData medicationRiskAssessment;

    /** Derived from timing, never taken from the extractor. */
    private int lengthOfStayDays;
}
