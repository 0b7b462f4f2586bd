package com.al.clinicalsummary.model.hospital;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admission and discharge timing. Dates are kept as extracted; they are parsed only when the
 * length of stay is derived.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TimingData {

    @NotBlank
    private String admissionDate;

    /** HH:MM */
    private String admissionTime;

    @NotBlank
    private String dischargeDate;

    private String dischargeTime;

    private AdmissionSource admissionSource;

    private DischargeDisposition dischargeDisposition;

    public enum AdmissionSource {
        @JsonProperty("emergency_dept")
        EMERGENCY_DEPT,
        @JsonProperty("direct_admission")
        DIRECT_ADMISSION,
        @JsonProperty("transfer")
        TRANSFER,
        @JsonProperty("scheduled")
        SCHEDULED
    }

    public enum DischargeDisposition {
        @JsonProperty("home")
        HOME,
        @JsonProperty("snf")
        SNF,
        @JsonProperty("home_health")
        HOME_HEALTH,
        @JsonProperty("rehab")
        REHAB,
        @JsonProperty("transfer")
        TRANSFER,
        @JsonProperty("expired")
        EXPIRED
    }
}
