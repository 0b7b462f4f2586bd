package com.al.clinicalsummary.exception;

import com.al.clinicalsummary.model.EntityKind;

/**
 * An extractor could not produce a valid payload.
 */
public class ExtractionException extends Exception {

    private final EntityKind kind;

    public ExtractionException(EntityKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(EntityKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public EntityKind getKind() {
        return kind;
    }
}
