package com.al.clinicalsummary.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Hospitalization id shared by both aggregates derived from one note.
 */
@Getter
@EqualsAndHashCode
public final class CorrelationId {

    private final String value;

    @EqualsAndHashCode.Exclude
    private final boolean callerSupplied;

    private CorrelationId(String value, boolean callerSupplied) {
        this.value = Objects.requireNonNull(value, "value");
        this.callerSupplied = callerSupplied;
    }

    public static CorrelationId supplied(String value) {
        return new CorrelationId(value, true);
    }

    public static CorrelationId generated(String value) {
        return new CorrelationId(value, false);
    }

    @Override
    public String toString() {
        return value;
    }
}
