package com.al.clinicalsummary.repository;

import com.al.clinicalsummary.model.HospitalSummaryRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface HospitalSummaryRepository extends MongoRepository<HospitalSummaryRecord, String> {

    Optional<HospitalSummaryRecord> findByHospitalizationId(String hospitalizationId);

    List<HospitalSummaryRecord> findTop10ByPatientIdOrderByCreatedAtDesc(String patientId);

    long deleteByHospitalizationId(String hospitalizationId);
}
