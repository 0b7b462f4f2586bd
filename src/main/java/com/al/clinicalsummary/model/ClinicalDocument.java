package com.al.clinicalsummary.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A submitted clinical note. Immutable once built.
 */
@Getter
@Builder
@ToString(exclude = "text")
public class ClinicalDocument {

    private final String text;

    private final String patientId;

    /**
     * Caller-supplied hospitalization id, reused as the correlation id when present.
     */
    private final String hospitalizationId;

    /**
     * Where the note came from (file name, queue), for logging only.
     */
    private final String source;

    public boolean hasHospitalizationId() {
        return hospitalizationId != null && !hospitalizationId.isBlank();
    }
}
