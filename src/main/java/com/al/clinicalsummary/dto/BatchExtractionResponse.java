package com.al.clinicalsummary.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response for batch extraction requests.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class BatchExtractionResponse {

    private int totalDocuments;
    private int successCount;
    private int partialCount;
    private int failureCount;
    private long processingTimeMs;
    private List<ExtractionReport> results = new ArrayList<>();
    private List<DocumentError> errors = new ArrayList<>();

    /**
     * A document that never produced a report (unreadable file, rejected submission).
     */
    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class DocumentError {
        private int index;
        private String source;
        private String message;
    }
}
