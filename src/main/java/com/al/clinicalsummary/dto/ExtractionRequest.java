package com.al.clinicalsummary.dto;

import com.al.clinicalsummary.model.ClinicalDocument;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ExtractionRequest {

    @NotBlank(message = "Patient ID is required")
    private String patientId;

    @Size(max = 255, message = "Hospitalization ID cannot exceed 255 characters")
    private String hospitalizationId;

    // Blank notes are accepted and still sent to every extractor
    @NotNull(message = "Note text is required")
    private String text;

    public ClinicalDocument toDocument(String source) {
        return ClinicalDocument.builder()
                .text(text)
                .patientId(patientId)
                .hospitalizationId(hospitalizationId)
                .source(source)
                .build();
    }
}
