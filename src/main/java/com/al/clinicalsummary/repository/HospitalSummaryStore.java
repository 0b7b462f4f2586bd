package com.al.clinicalsummary.repository;

import com.al.clinicalsummary.model.CorrelationId;
import com.al.clinicalsummary.model.HospitalSummary;
import com.al.clinicalsummary.model.HospitalSummaryRecord;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

@Component
public class HospitalSummaryStore extends MongoSummaryStore<HospitalSummary, HospitalSummaryRecord> {

    private final HospitalSummaryRepository repository;

    @Autowired
    public HospitalSummaryStore(HospitalSummaryRepository repository, ObjectMapper objectMapper) {
        this(repository, objectMapper, Clock.systemUTC());
    }

    HospitalSummaryStore(HospitalSummaryRepository repository, ObjectMapper objectMapper, Clock clock) {
        super(SummaryGroup.HOSPITAL, repository, objectMapper, clock);
        this.repository = repository;
    }

    @Override
    protected Optional<HospitalSummaryRecord> findExisting(String hospitalizationId) {
        return repository.findByHospitalizationId(hospitalizationId);
    }

    @Override
    protected HospitalSummaryRecord toRecord(CorrelationId correlationId, HospitalSummary summary) {
        HospitalSummaryRecord record = new HospitalSummaryRecord();
        record.setHospitalizationId(correlationId.getValue());
        record.setPatientId(summary.getPatientId());
        record.setFacility(toSection(summary.getFacility()));
        record.setTiming(toSection(summary.getTiming()));
        record.setDiagnosis(toSection(summary.getDiagnosis()));
        record.setMedicationRiskAssessment(toSection(summary.getMedicationRiskAssessment()));
        record.setLengthOfStayDays(summary.getLengthOfStayDays());
        return record;
    }
}
