package com.al.clinicalsummary.model.hospital;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FacilityData {

    @NotBlank
    private String facilityName;

    private String facilityId;

    @Builder.Default
    @JsonSetter(nulls = Nulls.SKIP)
    private FacilityType facilityType = FacilityType.ACUTE_CARE;

    private Address address;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Address {
        private String street;
        private String city;
        private String state;
        private String zip;
    }

    public enum FacilityType {
        @JsonEnumDefaultValue
        @JsonProperty("acute_care")
        ACUTE_CARE,
        @JsonProperty("psychiatric")
        PSYCHIATRIC,
        @JsonProperty("rehabilitation")
        REHABILITATION,
        @JsonProperty("ltac")
        LTAC
    }
}
