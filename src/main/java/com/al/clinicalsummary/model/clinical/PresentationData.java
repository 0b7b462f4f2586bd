package com.al.clinicalsummary.model.clinical;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * How the patient presented: symptoms and the circumstances of arrival.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PresentationData {

    @Builder.Default
    private List<String> symptoms = new ArrayList<>();

    /** Section of the note the symptoms were taken from. */
    private String symptomSource;

    private String presentationMethod;
    private String presentationDetails;
    private String presentationTimeline;

    @Builder.Default
    private List<String> severityIndicators = new ArrayList<>();
}
