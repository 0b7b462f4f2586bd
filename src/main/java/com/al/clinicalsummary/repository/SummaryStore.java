package com.al.clinicalsummary.repository;

import com.al.clinicalsummary.exception.PersistenceException;
import com.al.clinicalsummary.model.CorrelationId;

/**
 * Write side of one aggregate's store.
 *
 * @param <T> aggregate type
 */
public interface SummaryStore<T> {

    /**
     * Insert the aggregate, or replace the one already stored under the same correlation id.
     *
     * @return id of the stored record
     */
    String upsert(CorrelationId correlationId, T summary) throws PersistenceException;
}
