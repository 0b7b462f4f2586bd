package com.al.clinicalsummary.dto;

import com.al.clinicalsummary.exception.AssemblyException;
import com.al.clinicalsummary.model.EntityKind;
import com.al.clinicalsummary.model.enums.PersistenceStatus;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of writing one aggregate: the stored record id, or why nothing was stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistenceOutcome {

    private SummaryGroup aggregate;

    private PersistenceStatus status;

    /**
     * Id of the stored record. Set only when status is PERSISTED.
     */
    private String recordId;

    private String error;

    /**
     * Entity kinds that made assembly fail, when status is ASSEMBLY_FAILED.
     */
    @Builder.Default
    private List<String> failedKinds = new ArrayList<>();

    public boolean isPersisted() {
        return status == PersistenceStatus.PERSISTED;
    }

    public static PersistenceOutcome persisted(SummaryGroup aggregate, String recordId) {
        return PersistenceOutcome.builder()
                .aggregate(aggregate)
                .status(PersistenceStatus.PERSISTED)
                .recordId(recordId)
                .build();
    }

    public static PersistenceOutcome failed(SummaryGroup aggregate, String error) {
        return PersistenceOutcome.builder()
                .aggregate(aggregate)
                .status(PersistenceStatus.FAILED)
                .error(error)
                .build();
    }

    public static PersistenceOutcome assemblyFailed(AssemblyException e) {
        return PersistenceOutcome.builder()
                .aggregate(e.getGroup())
                .status(PersistenceStatus.ASSEMBLY_FAILED)
                .error(e.getMessage())
                .failedKinds(e.getFailedKinds().stream().map(EntityKind::getWireName).collect(Collectors.toList()))
                .build();
    }

    public static PersistenceOutcome cancelled(SummaryGroup aggregate) {
        return PersistenceOutcome.builder()
                .aggregate(aggregate)
                .status(PersistenceStatus.CANCELLED)
                .error("Processing cancelled")
                .build();
    }

    /**
     * Short human-readable line, e.g. "hospital summary failed: missing diagnosis".
     */
    public String describe() {
        String label = aggregate.getLabel();
        switch (status) {
            case PERSISTED:
                return label + " saved";
            case CANCELLED:
                return label + " cancelled";
            default:
                return label + " failed: " + error;
        }
    }
}
