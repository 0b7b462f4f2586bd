package com.al.clinicalsummary.model.enums;

/**
 * Combined status of one document across both aggregates.
 */
public enum ProcessingStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    CANCELLED
}
