package com.al.clinicalsummary.model.hospital;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Assessment of how likely the admission is medication related.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class MedicationRiskData {

    private Metadata metadata;

    @Valid
    private ClinicalContext clinicalContext;

    @Valid
    private RiskScoring riskScoring;

    @Valid
    @NotNull
    private LikelihoodPercentage likelihoodPercentage;

    @NotNull
    private RiskLevel riskLevel;

    @Valid
    @Builder.Default
    private List<RiskFactor> riskFactors = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<AlternativeExplanation> alternativeExplanations = new ArrayList<>();

    @Builder.Default
    private List<String> negativeFindings = new ArrayList<>();

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidenceScore;

    private String confidenceRationale;

    @Builder.Default
    @JsonSetter(nulls = Nulls.SKIP)
    private AssessmentMethod assessmentMethod = AssessmentMethod.AI_ANALYSIS;

    /** Filled with the assembly time when the extractor leaves it out. */
    private Instant assessedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        private String noteType;
        @Builder.Default
        private List<String> sectionsReviewed = new ArrayList<>();
        @Builder.Default
        private List<String> missingInformation = new ArrayList<>();
        @Builder.Default
        private List<String> modelUncertaintyNotes = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClinicalContext {
        @NotNull
        private PresentationType presentationType;
        private String presentationTypeRationale;
        private String primaryReasonForPresentation;
        private boolean medicationRelated;
        private String medicationRelationshipExplanation;
        private String patientClinicalStatus;
        @Builder.Default
        private List<String> organDysfunction = new ArrayList<>();

        @JsonProperty("is_medication_related")
        public boolean isMedicationRelated() {
            return medicationRelated;
        }

        @JsonProperty("is_medication_related")
        public void setMedicationRelated(boolean medicationRelated) {
            this.medicationRelated = medicationRelated;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RiskScoring {
        @Min(0)
        private int positiveEvidencePoints;
        @Min(0)
        private int negativeEvidencePoints;
        private int netScore;
        private String scoreBreakdown;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LikelihoodPercentage {
        @Min(0)
        @Max(100)
        private int percentage;
        @NotBlank
        private String evidence;
        @Builder.Default
        @JsonSetter(nulls = Nulls.SKIP)
        private String calculationMethod = "evidence_scoring_system";
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RiskFactor {
        @NotBlank
        private String factor;
        private String evidence;
        @NotNull
        private RiskSeverity severity;
        private String severityRationale;
        @Builder.Default
        private List<String> implicatedMedications = new ArrayList<>();
        private String mechanism;
        private String temporalRelationship;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AlternativeExplanation {
        @NotBlank
        private String explanation;
        private String likelihood;
        private String supportingEvidence;
        private String impactOnMedicationAssessment;
    }

    public enum RiskLevel {
        @JsonProperty("high")
        HIGH,
        @JsonProperty("medium")
        MEDIUM,
        @JsonProperty("low")
        LOW
    }

    public enum RiskSeverity {
        @JsonProperty("critical")
        CRITICAL,
        @JsonProperty("major")
        MAJOR,
        @JsonProperty("moderate")
        MODERATE,
        @JsonProperty("minor")
        MINOR
    }

    public enum AssessmentMethod {
        @JsonProperty("ai_analysis")
        AI_ANALYSIS,
        @JsonProperty("pharmacist_determination")
        PHARMACIST_DETERMINATION,
        @JsonProperty("combined")
        COMBINED
    }

    /** A: medication related, B: medication present but unrelated, C: management needed but not causative. */
    public enum PresentationType {
        A, B, C
    }
}
