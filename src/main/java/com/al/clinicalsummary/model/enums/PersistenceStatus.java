package com.al.clinicalsummary.model.enums;

public enum PersistenceStatus {
    PERSISTED,
    FAILED,
    ASSEMBLY_FAILED, // nothing written, no write attempted
    CANCELLED
}
