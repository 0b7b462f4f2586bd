package com.al.clinicalsummary.extraction;

import com.al.clinicalsummary.exception.ExtractionException;
import com.al.clinicalsummary.model.EntityKind;

/**
 * Produces one kind of entity payload from the text of a clinical note.
 * Implementations hold no per-document state and may be called concurrently.
 *
 * @param <T> payload type for the kind
 */
public interface EntityExtractor<T> {

    EntityKind getKind();

    /**
     * @param documentText note text, possibly empty
     * @return the payload, never null
     * @throws ExtractionException if no valid payload could be produced
     */
    T extract(String documentText) throws ExtractionException;
}
