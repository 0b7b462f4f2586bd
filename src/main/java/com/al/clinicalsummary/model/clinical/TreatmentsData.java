package com.al.clinicalsummary.model.clinical;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
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
 * Treatments and procedures given during the stay.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TreatmentsData {

    @Valid
    @Builder.Default
    private List<Treatment> treatmentsProcedures = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Treatment {
        private String id;
        @NotNull
        private TreatmentType treatmentType;
        @Builder.Default
        @JsonSetter(nulls = Nulls.SKIP)
        private TreatmentCategory category = TreatmentCategory.OTHER;
        @NotBlank
        private String description;
        private String clinicalIndication;
        private String startedAt;
        private String endedAt;
        private String duration;
        private String timingQualifier;
        private String location;
        private String outcome;
        private String complications;
        private String documentedInSection;
        @Valid
        private MedicationDetails medicationDetails;
        @Valid
        private ProcedureDetails procedureDetails;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MedicationDetails {
        @NotBlank
        private String medicationName;
        private Route route;
        private String dose;
        private String frequency;
        @NotNull
        private MedicationAction action;
        private String reasonForAction;
        private boolean relatedToAdmissionReason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProcedureDetails {
        @NotBlank
        private String procedureName;
        private String procedureCode;
        private String performedBy;
        private String approach;
        private String findings;
        private String specimensCollected;
    }

    public enum TreatmentType {
        @JsonProperty("medication")
        MEDICATION,
        @JsonProperty("procedure")
        PROCEDURE,
        @JsonProperty("monitoring")
        MONITORING,
        @JsonProperty("supportive_care")
        SUPPORTIVE_CARE,
        @JsonProperty("therapeutic_intervention")
        THERAPEUTIC_INTERVENTION,
        @JsonProperty("diagnostic_test")
        DIAGNOSTIC_TEST
    }

    public enum TreatmentCategory {
        @JsonProperty("cardiovascular")
        CARDIOVASCULAR,
        @JsonProperty("respiratory")
        RESPIRATORY,
        @JsonProperty("renal")
        RENAL,
        @JsonProperty("metabolic")
        METABOLIC,
        @JsonProperty("infectious_disease")
        INFECTIOUS_DISEASE,
        @JsonProperty("pain_management")
        PAIN_MANAGEMENT,
        @JsonProperty("nutritional")
        NUTRITIONAL,
        @JsonProperty("psychiatric")
        PSYCHIATRIC,
        @JsonEnumDefaultValue
        @JsonProperty("other")
        OTHER
    }

    public enum Route {
        @JsonProperty("IV")
        IV,
        @JsonProperty("oral")
        ORAL,
        @JsonProperty("subcutaneous")
        SUBCUTANEOUS,
        @JsonProperty("intramuscular")
        INTRAMUSCULAR,
        @JsonProperty("topical")
        TOPICAL,
        @JsonProperty("inhalation")
        INHALATION
    }

    public enum MedicationAction {
        @JsonProperty("started")
        STARTED,
        @JsonProperty("discontinued")
        DISCONTINUED,
        @JsonProperty("dose_adjusted")
        DOSE_ADJUSTED,
        @JsonProperty("continued")
        CONTINUED,
        @JsonProperty("switched")
        SWITCHED
    }
}
