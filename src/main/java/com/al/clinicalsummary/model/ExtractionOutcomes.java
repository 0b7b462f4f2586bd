package com.al.clinicalsummary.model;

import com.al.clinicalsummary.model.enums.OutcomeStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcomes of one orchestration run, keyed by entity kind.
 */
public class ExtractionOutcomes {

    private final Map<EntityKind, EntityOutcome> outcomes = new EnumMap<>(EntityKind.class);

    public ExtractionOutcomes(Collection<EntityOutcome> outcomes) {
        for (EntityOutcome outcome : outcomes) {
            if (this.outcomes.put(outcome.getKind(), outcome) != null) {
                throw new IllegalArgumentException("Duplicate outcome for " + outcome.getKind().getWireName());
            }
        }
    }

    public EntityOutcome get(EntityKind kind) {
        return outcomes.get(kind);
    }

    public boolean isSuccess(EntityKind kind) {
        EntityOutcome outcome = outcomes.get(kind);
        return outcome != null && outcome.isSuccess();
    }

    /**
     * Payload for the kind, or null when it is missing or did not succeed.
     */
    public <T> T payloadOrNull(EntityKind kind, Class<T> type) {
        return isSuccess(kind) ? outcomes.get(kind).payloadAs(type) : null;
    }

    public Collection<EntityOutcome> all() {
        return Collections.unmodifiableCollection(outcomes.values());
    }

    public List<EntityKind> unsuccessful(Collection<EntityKind> kinds) {
        List<EntityKind> failed = new ArrayList<>();
        for (EntityKind kind : kinds) {
            if (!isSuccess(kind)) {
                failed.add(kind);
            }
        }
        return failed;
    }

    public int size() {
        return outcomes.size();
    }

    public long count(OutcomeStatus status) {
        return outcomes.values().stream().filter(o -> o.getStatus() == status).count();
    }
}
