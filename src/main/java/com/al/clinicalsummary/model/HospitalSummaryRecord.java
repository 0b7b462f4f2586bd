package com.al.clinicalsummary.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Stored hospital admission summary. Sections are kept in their JSON shape
 * (snake_case keys, lowercase enum values).
 */
@Data
@Document(collection = "hospital_summaries")
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HospitalSummaryRecord implements SummaryRecord {
    @Id
    private String id;

    // One record per hospitalization; upserts match on this
    @Indexed(unique = true, sparse = true)
    @Field("hospitalization_id")
    private String hospitalizationId;

    @Indexed
    @Field("patient_id")
    private String patientId;

    private Map<String, Object> facility;
    private Map<String, Object> timing;
    private Map<String, Object> diagnosis;

    @Field("medication_risk_assessment")
    private Map<String, Object> medicationRiskAssessment;

    @Field("length_of_stay_days")
    private int lengthOfStayDays;

    @Indexed
    @Field("created_at")
    private Instant createdAt;

    @Field("updated_at")
    private Instant updatedAt;
}
