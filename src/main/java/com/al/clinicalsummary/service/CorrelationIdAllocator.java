package com.al.clinicalsummary.service;

import com.al.clinicalsummary.model.ClinicalDocument;
import com.al.clinicalsummary.model.CorrelationId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Issues the hospitalization id shared by both aggregates of a document.
 */
@Service
@Slf4j
public class CorrelationIdAllocator {

    /**
     * Reuse the caller's hospitalization id verbatim, or mint a random (122-bit entropy) UUID.
     */
    public CorrelationId allocate(ClinicalDocument document) {
        if (document.hasHospitalizationId()) {
            log.debug("Reusing caller-supplied hospitalization id {}", document.getHospitalizationId());
            return CorrelationId.supplied(document.getHospitalizationId());
        }
        CorrelationId generated = CorrelationId.generated(UUID.randomUUID().toString());
        log.debug("Generated hospitalization id {}", generated);
        return generated;
    }
}
