package com.al.clinicalsummary.model.clinical;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Clinician assessment: diagnoses, reasoning, and whether medications were implicated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssessmentData {

    @NotBlank
    private String primaryDiagnosis;

    private String primaryDiagnosisSource;

    @Builder.Default
    private List<String> secondaryDiagnoses = new ArrayList<>();

    @Builder.Default
    private List<String> clinicalReasoning = new ArrayList<>();

    @Valid
    private MedicationRelationship medicationRelationship;

    @Valid
    private CauseDetermination causeDetermination;

    @Valid
    private FallRiskAssessment fallRiskAssessment;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MedicationRelationship {
        @Builder.Default
        private List<String> implicatedMedications = new ArrayList<>();
        private String mechanism;
        private String mechanismEvidence;
        @NotNull
        private Confidence confidence;
        private String confidenceRationale;
        private String temporalRelationship;
        @Builder.Default
        private List<String> additionalFactors = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CauseDetermination {
        @NotBlank
        private String cause;
        @Builder.Default
        private List<String> supportingEvidence = new ArrayList<>();
        private String evidenceSource;
        @NotNull
        private Confidence confidence;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FallRiskAssessment {
        @NotNull
        private FallRiskLevel riskLevel;
        @Builder.Default
        private List<String> contributingFactors = new ArrayList<>();
    }

    public enum Confidence {
        @JsonProperty("definite")
        DEFINITE,
        @JsonProperty("probable")
        PROBABLE,
        @JsonProperty("possible")
        POSSIBLE,
        @JsonProperty("uncertain")
        UNCERTAIN
    }

    public enum FallRiskLevel {
        @JsonProperty("low")
        LOW,
        @JsonProperty("moderate")
        MODERATE,
        @JsonProperty("high")
        HIGH
    }
}
