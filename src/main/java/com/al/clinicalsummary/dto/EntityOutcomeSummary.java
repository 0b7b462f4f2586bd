package com.al.clinicalsummary.dto;

import com.al.clinicalsummary.model.EntityOutcome;
import com.al.clinicalsummary.model.enums.OutcomeStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class EntityOutcomeSummary {
    private String kind;
    private OutcomeStatus status;
    private String error;
    private long elapsedMs;

    public static EntityOutcomeSummary from(EntityOutcome outcome) {
        return new EntityOutcomeSummary(outcome.getKind().getWireName(), outcome.getStatus(),
                outcome.getError(), outcome.getElapsedMs());
    }
}
