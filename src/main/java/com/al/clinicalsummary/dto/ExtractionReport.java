package com.al.clinicalsummary.dto;

import com.al.clinicalsummary.model.enums.ProcessingStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * What the caller gets back for one document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionReport {

    private String hospitalizationId;
    private String patientId;
    private ProcessingStatus status;

    /** e.g. "clinical summary saved, hospital summary failed: missing diagnosis" */
    private String message;

    private PersistenceOutcome clinical;
    private PersistenceOutcome hospital;

    @Builder.Default
    private List<EntityOutcomeSummary> entities = new ArrayList<>();

    private long processingTimeMs;
}
