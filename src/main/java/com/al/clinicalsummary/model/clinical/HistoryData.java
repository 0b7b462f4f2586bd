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
 * Past medical history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HistoryData {

    @Valid
    @Builder.Default
    private List<MedicalCondition> conditions = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MedicalCondition {
        @NotBlank
        private String conditionName;
        private String icd10Code;
        private String icd10Source;
        private String severity;
        @NotNull
        private ConditionStatus status;
        private String statusRationale;
        private String location;
        private String notes;
        private String documentedInSection;
    }

    public enum ConditionStatus {
        @JsonProperty("active")
        ACTIVE,
        @JsonProperty("resolved")
        RESOLVED,
        @JsonProperty("historical")
        HISTORICAL
    }
}
