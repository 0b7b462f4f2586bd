package com.al.clinicalsummary.model.hospital;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Output of the facility/timing extractor. One extractor, two hospital sections.
 * {@code patientId} and {@code hospitalizationId} are whatever the note itself states and
 * never replace the correlation id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FacilityTimingData {

    @Valid
    @NotNull
    private FacilityData facility;

    @Valid
    @NotNull
    private TimingData timing;

    private String patientId;

    private String hospitalizationId;
}
