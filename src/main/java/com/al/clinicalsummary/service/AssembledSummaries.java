package com.al.clinicalsummary.service;

import com.al.clinicalsummary.exception.AssemblyException;
import com.al.clinicalsummary.model.ClinicalSummary;
import com.al.clinicalsummary.model.HospitalSummary;
import lombok.Getter;

/**
 * Output of assembly: the clinical summary (always built) and either the hospital summary or
 * the reason it could not be built.
 */
@Getter
public final class AssembledSummaries {

    private final ClinicalSummary clinical;
    private final HospitalSummary hospital;
    private final AssemblyException hospitalFailure;

    private AssembledSummaries(ClinicalSummary clinical, HospitalSummary hospital, AssemblyException hospitalFailure) {
        this.clinical = clinical;
        this.hospital = hospital;
        this.hospitalFailure = hospitalFailure;
    }

    public static AssembledSummaries of(ClinicalSummary clinical, HospitalSummary hospital) {
        return new AssembledSummaries(clinical, hospital, null);
    }

    public static AssembledSummaries withHospitalFailure(ClinicalSummary clinical, AssemblyException failure) {
        return new AssembledSummaries(clinical, null, failure);
    }

    public boolean isHospitalAssembled() {
        return hospital != null;
    }
}
