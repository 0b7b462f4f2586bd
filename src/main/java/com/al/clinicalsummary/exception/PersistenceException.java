package com.al.clinicalsummary.exception;

import com.al.clinicalsummary.model.enums.SummaryGroup;

/**
 * A write to one of the summary stores failed.
 */
public class PersistenceException extends Exception {

    private final SummaryGroup group;

    public PersistenceException(SummaryGroup group, String message, Throwable cause) {
        super(message, cause);
        this.group = group;
    }

    public SummaryGroup getGroup() {
        return group;
    }
}
