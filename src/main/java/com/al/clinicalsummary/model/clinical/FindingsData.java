package com.al.clinicalsummary.model.clinical;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Objective findings: labs, vitals, exam, imaging and body measurements.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FindingsData {

    @Valid
    @Builder.Default
    private List<LabTest> labResults = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<VitalSign> vitalSigns = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<PhysicalExamFinding> physicalExamFindings = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<ImagingFinding> imagingFindings = new ArrayList<>();

    private Anthropometrics anthropometrics;

    @Builder.Default
    private Map<String, String> diagnosticNotes = new LinkedHashMap<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VitalSign {
        @NotBlank
        private String measurement;
        private String value;
        private String unit;
        private String status;
        private String clinicalSignificance;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PhysicalExamFinding {
        @NotBlank
        private String system;
        private String finding;
        private String status;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ImagingFinding {
        @NotBlank
        private String study;
        private String date;
        @Builder.Default
        private List<String> findings = new ArrayList<>();
        private String impression;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Anthropometrics {
        private Measurement height;
        private Measurement weight;
        private Measurement bmi;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Measurement {
        private Double value;
        private String unit;
        private String notes;
    }
}
