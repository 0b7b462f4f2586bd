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
import java.util.List;

/**
 * Hospital course as narrated in the note. Dates here are free text and are not used for
 * the length-of-stay calculation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CourseData {

    @Valid
    @Builder.Default
    private List<TimelineEvent> timeline = new ArrayList<>();

    private String narrativeSummary;
    private String disposition;
    private String lengthOfStay;
    private String patientResponse;
    private String admissionDate;
    private String dischargeDate;

    @Builder.Default
    private List<String> followUpPlans = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimelineEvent {
        @NotBlank
        private String event;
        private String time;
        private String details;
    }
}
