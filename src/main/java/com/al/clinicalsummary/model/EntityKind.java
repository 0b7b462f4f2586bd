package com.al.clinicalsummary.model;

import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.al.clinicalsummary.model.clinical.AssessmentData;
import com.al.clinicalsummary.model.clinical.CourseData;
import com.al.clinicalsummary.model.clinical.FindingsData;
import com.al.clinicalsummary.model.clinical.FollowUpData;
import com.al.clinicalsummary.model.clinical.HistoryData;
import com.al.clinicalsummary.model.clinical.LabsData;
import com.al.clinicalsummary.model.clinical.PresentationData;
import com.al.clinicalsummary.model.clinical.TreatmentsData;
import com.al.clinicalsummary.model.hospital.DiagnosisData;
import com.al.clinicalsummary.model.hospital.FacilityTimingData;
import com.al.clinicalsummary.model.hospital.MedicationRiskData;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Closed set of entity kinds extracted from a note. Each kind belongs to exactly one
 * aggregate group and has a fixed payload type.
 */
public enum EntityKind {
    PRESENTATION("presentation", SummaryGroup.CLINICAL, PresentationData.class),
    HISTORY("history", SummaryGroup.CLINICAL, HistoryData.class),
    FINDINGS("findings", SummaryGroup.CLINICAL, FindingsData.class),
    ASSESSMENT("assessment", SummaryGroup.CLINICAL, AssessmentData.class),
    COURSE("course", SummaryGroup.CLINICAL, CourseData.class),
    FOLLOW_UP("follow_up", SummaryGroup.CLINICAL, FollowUpData.class),
    TREATMENTS("treatments", SummaryGroup.CLINICAL, TreatmentsData.class),
    LABS("labs", SummaryGroup.CLINICAL, LabsData.class),
    FACILITY_TIMING("facility_timing", SummaryGroup.HOSPITAL, FacilityTimingData.class),
    DIAGNOSIS("diagnosis", SummaryGroup.HOSPITAL, DiagnosisData.class),
    MEDICATION_RISK("medication_risk", SummaryGroup.HOSPITAL, MedicationRiskData.class);

    private final String wireName;
    private final SummaryGroup group;
    private final Class<?> payloadType;

    EntityKind(String wireName, SummaryGroup group, Class<?> payloadType) {
        this.wireName = wireName;
        this.group = group;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public SummaryGroup getGroup() {
        return group;
    }

    public Class<?> getPayloadType() {
        return payloadType;
    }

    public static List<EntityKind> forGroup(SummaryGroup group) {
        List<EntityKind> kinds = new ArrayList<>();
        for (EntityKind kind : values()) {
            if (kind.group == group) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    public static EntityKind fromWireName(String wireName) {
        for (EntityKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + wireName);
    }
}
