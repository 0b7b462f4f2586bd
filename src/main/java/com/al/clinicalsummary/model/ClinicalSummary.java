package com.al.clinicalsummary.model;

import com.al.clinicalsummary.model.clinical.AssessmentData;
import com.al.clinicalsummary.model.clinical.CourseData;
import com.al.clinicalsummary.model.clinical.FindingsData;
import com.al.clinicalsummary.model.clinical.FollowUpData;
import com.al.clinicalsummary.model.clinical.HistoryData;
import com.al.clinicalsummary.model.clinical.LabsData;
import com.al.clinicalsummary.model.clinical.PresentationData;
import com.al.clinicalsummary.model.clinical.TreatmentsData;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Best-effort clinical aggregate. Every section is always present as a member and is null
 * when its extractor did not succeed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClinicalSummary {

    private CorrelationId correlationId;
    private String patientId;

    private PresentationData presentation;
    private HistoryData history;
    private FindingsData findings;
    private AssessmentData assessment;
    private CourseData course;
    private FollowUpData followUp;
    private TreatmentsData treatments;
    private LabsData labs;

    private Instant parsedAt;
    private String parsingModelVersion;

    public List<EntityKind> getMissingSections() {
        List<EntityKind> missing = new ArrayList<>();
        addIfNull(missing, presentation, EntityKind.PRESENTATION);
        addIfNull(missing, history, EntityKind.HISTORY);
        addIfNull(missing, findings, EntityKind.FINDINGS);
        addIfNull(missing, assessment, EntityKind.ASSESSMENT);
        addIfNull(missing, course, EntityKind.COURSE);
        addIfNull(missing, followUp, EntityKind.FOLLOW_UP);
        addIfNull(missing, treatments, EntityKind.TREATMENTS);
        addIfNull(missing, labs, EntityKind.LABS);
        return missing;
    }

    private static void addIfNull(List<EntityKind> missing, Object section, EntityKind kind) {
        if (section == null) {
            missing.add(kind);
        }
    }
}
