package com.al.clinicalsummary.repository;

import com.al.clinicalsummary.model.ClinicalSummaryRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ClinicalSummaryRepository extends MongoRepository<ClinicalSummaryRecord, String> {

    Optional<ClinicalSummaryRecord> findByHospitalizationId(String hospitalizationId);

    List<ClinicalSummaryRecord> findTop10ByPatientIdOrderByCreatedAtDesc(String patientId);

    long deleteByHospitalizationId(String hospitalizationId);
}
