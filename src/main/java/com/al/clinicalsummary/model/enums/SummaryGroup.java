package com.al.clinicalsummary.model.enums;

/**
 * The two aggregates a note is split into.
 */
public enum SummaryGroup {
    CLINICAL("clinical summary"),
    HOSPITAL("hospital summary");

    private final String label;

    SummaryGroup(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
