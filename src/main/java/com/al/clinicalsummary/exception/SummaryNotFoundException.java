package com.al.clinicalsummary.exception;

public class SummaryNotFoundException extends RuntimeException {

    public SummaryNotFoundException(String message) {
        super(message);
    }
}
