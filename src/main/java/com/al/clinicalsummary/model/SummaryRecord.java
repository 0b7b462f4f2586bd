package com.al.clinicalsummary.model;

import java.time.Instant;

/**
 * Fields every stored summary carries, whatever its sections.
 */
public interface SummaryRecord {

    String getId();

    void setId(String id);

    String getHospitalizationId();

    Instant getCreatedAt();

    void setCreatedAt(Instant createdAt);

    void setUpdatedAt(Instant updatedAt);
}
