package com.al.clinicalsummary.service;

import com.al.clinicalsummary.dto.PersistenceOutcome;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The two independent write outcomes for one document.
 */
@Getter
@AllArgsConstructor
public class PersistenceResult {
    private final PersistenceOutcome clinical;
    private final PersistenceOutcome hospital;

    public int persistedCount() {
        return (clinical.isPersisted() ? 1 : 0) + (hospital.isPersisted() ? 1 : 0);
    }
}
