package com.al.clinicalsummary.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class BatchExtractionRequest {

    @NotEmpty(message = "Documents list cannot be empty")
    @Size(max = 50, message = "Batch size cannot exceed 50 documents")
    @Valid
    private List<ExtractionRequest> documents;
}
