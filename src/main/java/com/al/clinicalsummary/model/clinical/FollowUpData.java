package com.al.clinicalsummary.model.clinical;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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
public class FollowUpData {

    @Valid
    @Builder.Default
    private List<Appointment> appointments = new ArrayList<>();

    @Builder.Default
    private List<String> dischargeInstructions = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private List<String> patientEducation = new ArrayList<>();

    @Builder.Default
    private List<String> careTransitions = new ArrayList<>();

    private CareCoordination careCoordination;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Appointment {
        @NotBlank
        private String specialty;
        @Builder.Default
        private Urgency urgency = Urgency.ROUTINE;
        private String timeframe;
        private String provider;
        private String location;
        private String notes;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CareCoordination {
        @Builder.Default
        private List<String> services = new ArrayList<>();
        private String responsibleTeam;
        private String instructions;
    }

    public enum Urgency {
        @JsonProperty("urgent")
        URGENT,
        @JsonProperty("routine")
        ROUTINE,
        @JsonProperty("as_needed")
        AS_NEEDED
    }
}
