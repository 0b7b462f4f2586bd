package com.al.clinicalsummary.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OutcomeStatus {
    SUCCESS("success"),
    FAILED("failed"),
    TIMED_OUT("timed_out");

    private final String value;

    OutcomeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
