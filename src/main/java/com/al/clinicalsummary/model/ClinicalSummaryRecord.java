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
 * Stored clinical summary. Any of the eight sections may be absent.
 */
@Data
@Document(collection = "clinical_summaries")
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClinicalSummaryRecord implements SummaryRecord {
    @Id
    private String id;

    @Indexed(unique = true, sparse = true)
    @Field("hospitalization_id")
    private String hospitalizationId;

    @Indexed
    @Field("patient_id")
    private String patientId;

    private Map<String, Object> presentation;
    private Map<String, Object> history;
    private Map<String, Object> findings;
    private Map<String, Object> assessment;
    private Map<String, Object> course;

    @Field("follow_up")
    private Map<String, Object> followUp;

    private Map<String, Object> treatments;
    private Map<String, Object> labs;

    @Field("parsed_at")
    private Instant parsedAt;

    @Field("parsing_model_version")
    private String parsingModelVersion;

    @Indexed
    @Field("created_at")
    private Instant createdAt;

    @Field("updated_at")
    private Instant updatedAt;
}
