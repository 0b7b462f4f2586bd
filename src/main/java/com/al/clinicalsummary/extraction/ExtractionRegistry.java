package com.al.clinicalsummary.extraction;

import com.al.clinicalsummary.model.EntityKind;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Fixed table from entity kind to its extractor. Every kind must be covered exactly once.
 */
@Slf4j
public class ExtractionRegistry {

    private final Map<EntityKind, EntityExtractor<?>> extractors = new EnumMap<>(EntityKind.class);

    public ExtractionRegistry(Collection<? extends EntityExtractor<?>> extractors) {
        for (EntityExtractor<?> extractor : extractors) {
            EntityExtractor<?> previous = this.extractors.put(extractor.getKind(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate extractor for " + extractor.getKind().getWireName());
            }
        }
        Set<EntityKind> missing = EnumSet.allOf(EntityKind.class);
        missing.removeAll(this.extractors.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No extractor registered for " + missing);
        }
        log.info("ExtractionRegistry initialized with {} extractors", this.extractors.size());
    }

    public EntityExtractor<?> get(EntityKind kind) {
        return extractors.get(kind);
    }

    public Set<EntityKind> kinds() {
        return Collections.unmodifiableSet(extractors.keySet());
    }

    public int size() {
        return extractors.size();
    }
}
