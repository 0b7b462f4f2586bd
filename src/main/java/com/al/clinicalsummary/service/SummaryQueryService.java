package com.al.clinicalsummary.service;

import com.al.clinicalsummary.exception.SummaryNotFoundException;
import com.al.clinicalsummary.model.ClinicalSummaryRecord;
import com.al.clinicalsummary.model.HospitalSummaryRecord;
import com.al.clinicalsummary.repository.ClinicalSummaryRepository;
import com.al.clinicalsummary.repository.HospitalSummaryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read and delete access to stored summaries.
 */
@Service
@Slf4j
public class SummaryQueryService {

    private final HospitalSummaryRepository hospitalRepository;
    private final ClinicalSummaryRepository clinicalRepository;

    public SummaryQueryService(HospitalSummaryRepository hospitalRepository,
            ClinicalSummaryRepository clinicalRepository) {
        this.hospitalRepository = hospitalRepository;
        this.clinicalRepository = clinicalRepository;
    }

    public HospitalSummaryRecord getHospitalSummary(String hospitalizationId) {
        return hospitalRepository.findByHospitalizationId(hospitalizationId)
                .orElseThrow(() -> new SummaryNotFoundException(
                        "No hospital summary for hospitalization " + hospitalizationId));
    }

    public ClinicalSummaryRecord getClinicalSummary(String hospitalizationId) {
        return clinicalRepository.findByHospitalizationId(hospitalizationId)
                .orElseThrow(() -> new SummaryNotFoundException(
                        "No clinical summary for hospitalization " + hospitalizationId));
    }

    /** Latest 10, newest first. */
    public List<HospitalSummaryRecord> listHospitalSummaries(String patientId) {
        return hospitalRepository.findTop10ByPatientIdOrderByCreatedAtDesc(patientId);
    }

    /** Latest 10, newest first. */
    public List<ClinicalSummaryRecord> listClinicalSummaries(String patientId) {
        return clinicalRepository.findTop10ByPatientIdOrderByCreatedAtDesc(patientId);
    }

    /**
     * Delete both summaries of a hospitalization.
     *
     * @return number of records removed
     * @throws SummaryNotFoundException if neither summary existed
     */
    public long deleteSummaries(String hospitalizationId) {
        long deleted = hospitalRepository.deleteByHospitalizationId(hospitalizationId)
                + clinicalRepository.deleteByHospitalizationId(hospitalizationId);
        if (deleted == 0) {
            throw new SummaryNotFoundException("No summaries for hospitalization " + hospitalizationId);
        }
        log.info("Deleted {} summaries for hospitalization {}", deleted, hospitalizationId);
        return deleted;
    }
}
