package com.al.clinicalsummary.repository;

import com.al.clinicalsummary.model.ClinicalSummary;
import com.al.clinicalsummary.model.ClinicalSummaryRecord;
import com.al.clinicalsummary.model.CorrelationId;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

@Component
public class ClinicalSummaryStore extends MongoSummaryStore<ClinicalSummary, ClinicalSummaryRecord> {

    private final ClinicalSummaryRepository repository;

    @Autowired
    public ClinicalSummaryStore(ClinicalSummaryRepository repository, ObjectMapper objectMapper) {
        this(repository, objectMapper, Clock.systemUTC());
    }

    ClinicalSummaryStore(ClinicalSummaryRepository repository, ObjectMapper objectMapper, Clock clock) {
        super(SummaryGroup.CLINICAL, repository, objectMapper, clock);
        this.repository = repository;
    }

    @Override
    protected Optional<ClinicalSummaryRecord> findExisting(String hospitalizationId) {
        return repository.findByHospitalizationId(hospitalizationId);
    }

    @Override
    protected ClinicalSummaryRecord toRecord(CorrelationId correlationId, ClinicalSummary summary) {
        ClinicalSummaryRecord record = new ClinicalSummaryRecord();
        record.setHospitalizationId(correlationId.getValue());
        record.setPatientId(summary.getPatientId());
        record.setPresentation(toSection(summary.getPresentation()));
        record.setHistory(toSection(summary.getHistory()));
        record.setFindings(toSection(summary.getFindings()));
        record.setAssessment(toSection(summary.getAssessment()));
        record.setCourse(toSection(summary.getCourse()));
        record.setFollowUp(toSection(summary.getFollowUp()));
        record.setTreatments(toSection(summary.getTreatments()));
        record.setLabs(toSection(summary.getLabs()));
        record.setParsedAt(summary.getParsedAt());
        record.setParsingModelVersion(summary.getParsingModelVersion());
        return record;
    }
}
