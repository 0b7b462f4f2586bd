package com.al.clinicalsummary.exception;

import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.al.clinicalsummary.model.EntityKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An aggregate could not be assembled. Names the entity kinds responsible.
 */
public class AssemblyException extends Exception {

    private final SummaryGroup group;
    private final List<EntityKind> failedKinds;

    public AssemblyException(SummaryGroup group, List<EntityKind> failedKinds, String message) {
        super(message);
        this.group = group;
        this.failedKinds = List.copyOf(failedKinds);
    }

    public AssemblyException(SummaryGroup group, List<EntityKind> failedKinds, String message, Throwable cause) {
        super(message, cause);
        this.group = group;
        this.failedKinds = List.copyOf(failedKinds);
    }

    public static AssemblyException missing(SummaryGroup group, List<EntityKind> failedKinds) {
        String names = failedKinds.stream().map(EntityKind::getWireName).collect(Collectors.joining(", "));
        return new AssemblyException(group, failedKinds, "missing " + names);
    }

    public SummaryGroup getGroup() {
        return group;
    }

    public List<EntityKind> getFailedKinds() {
        return failedKinds;
    }
}
