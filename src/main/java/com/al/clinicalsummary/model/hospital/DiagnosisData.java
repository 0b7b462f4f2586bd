package com.al.clinicalsummary.model.hospital;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiagnosisData {

    @NotBlank
    private String primaryDiagnosis;

    private String primaryDiagnosisIcd10;

    @NotBlank
    private String primaryDiagnosisEvidence;

    /** cardiovascular, renal, respiratory, ... or other */
    @NotBlank
    private String diagnosisCategory;

    @Valid
    @Builder.Default
    private List<SecondaryDiagnosis> secondaryDiagnoses = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SecondaryDiagnosis {
        @NotBlank
        private String diagnosis;
        private String icd10Code;
        private String evidence;
        private String relationshipToPrimary;
    }
}
