package com.al.clinicalsummary.controller;

import com.al.clinicalsummary.model.ClinicalSummaryRecord;
import com.al.clinicalsummary.model.HospitalSummaryRecord;
import com.al.clinicalsummary.service.SummaryQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/summaries")
@Tag(name = "Summaries")
public class SummaryController {

    private final SummaryQueryService summaryQueryService;

    public SummaryController(SummaryQueryService summaryQueryService) {
        this.summaryQueryService = summaryQueryService;
    }

    @GetMapping("/hospital/{hospitalizationId}")
    public ResponseEntity<HospitalSummaryRecord> getHospitalSummary(@PathVariable String hospitalizationId) {
        return ResponseEntity.ok(summaryQueryService.getHospitalSummary(hospitalizationId));
    }

    @GetMapping("/clinical/{hospitalizationId}")
    public ResponseEntity<ClinicalSummaryRecord> getClinicalSummary(@PathVariable String hospitalizationId) {
        return ResponseEntity.ok(summaryQueryService.getClinicalSummary(hospitalizationId));
    }

    @GetMapping("/hospital")
    @Operation(summary = "Latest hospital summaries for a patient")
    public ResponseEntity<List<HospitalSummaryRecord>> listHospitalSummaries(@RequestParam String patientId) {
        return ResponseEntity.ok(summaryQueryService.listHospitalSummaries(patientId));
    }

    @GetMapping("/clinical")
    @Operation(summary = "Latest clinical summaries for a patient")
    public ResponseEntity<List<ClinicalSummaryRecord>> listClinicalSummaries(@RequestParam String patientId) {
        return ResponseEntity.ok(summaryQueryService.listClinicalSummaries(patientId));
    }

    @DeleteMapping("/{hospitalizationId}")
    @Operation(summary = "Delete both summaries of a hospitalization")
    public ResponseEntity<Map<String, Object>> deleteSummaries(@PathVariable String hospitalizationId) {
        long deleted = summaryQueryService.deleteSummaries(hospitalizationId);
        return ResponseEntity.ok(Map.<String, Object>of("hospitalizationId", hospitalizationId, "deleted", deleted));
    }
}
