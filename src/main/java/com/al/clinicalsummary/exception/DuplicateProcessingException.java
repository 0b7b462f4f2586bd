package com.al.clinicalsummary.exception;

public class DuplicateProcessingException extends RuntimeException {

    public DuplicateProcessingException(String hospitalizationId) {
        super("Hospitalization " + hospitalizationId + " is already being processed");
    }
}
