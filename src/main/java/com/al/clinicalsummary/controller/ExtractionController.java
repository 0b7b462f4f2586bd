package com.al.clinicalsummary.controller;

import com.al.clinicalsummary.dto.BatchExtractionRequest;
import com.al.clinicalsummary.dto.BatchExtractionResponse;
import com.al.clinicalsummary.dto.ExtractionReport;
import com.al.clinicalsummary.dto.ExtractionRequest;
import com.al.clinicalsummary.exception.SummaryNotFoundException;
import com.al.clinicalsummary.model.ClinicalDocument;
import com.al.clinicalsummary.model.CorrelationId;
import com.al.clinicalsummary.service.BatchExtractionService;
import com.al.clinicalsummary.service.CorrelationIdAllocator;
import com.al.clinicalsummary.service.SummaryExtractionHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/extractions")
@Tag(name = "Extraction")
@Slf4j
public class ExtractionController {

    /** 207 Multi-Status: one summary stored, the other not. */
    static final int MULTI_STATUS = 207;

    private final SummaryExtractionHandler handler;
    private final BatchExtractionService batchExtractionService;
    private final CorrelationIdAllocator correlationIdAllocator;
    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;

    @Value("${app.rabbitmq.exchange}")
    private String exchange;

    @Value("${app.rabbitmq.routingkey}")
    private String routingKey;

    @Autowired
    public ExtractionController(SummaryExtractionHandler handler,
            BatchExtractionService batchExtractionService,
            CorrelationIdAllocator correlationIdAllocator,
            RabbitTemplate rabbitTemplate,
            ObjectMapper objectMapper) {
        this.handler = handler;
        this.batchExtractionService = batchExtractionService;
        this.correlationIdAllocator = correlationIdAllocator;
        this.rabbitTemplate = rabbitTemplate;
        this.objectMapper = objectMapper;
    }

    @PostMapping
    @Operation(summary = "Extract and store summaries for one note, waiting for the result")
    public ResponseEntity<ExtractionReport> extract(@Valid @RequestBody ExtractionRequest request) {
        ExtractionReport report = handler.process(request.toDocument("api"));
        return ResponseEntity.status(statusFor(report)).body(report);
    }

    @PostMapping("/batch")
    @Operation(summary = "Extract summaries for several notes in parallel")
    public ResponseEntity<BatchExtractionResponse> extractBatch(@Valid @RequestBody BatchExtractionRequest request) {
        List<ClinicalDocument> documents = request.getDocuments().stream()
                .map(document -> document.toDocument("batch"))
                .collect(Collectors.toList());
        return ResponseEntity.ok(batchExtractionService.processBatch(documents));
    }

    @PostMapping("/async")
    @Operation(summary = "Queue a note for extraction; the hospitalization id is returned immediately")
    public ResponseEntity<Map<String, String>> extractAsync(@Valid @RequestBody ExtractionRequest request)
            throws JsonProcessingException {
        CorrelationId correlationId = correlationIdAllocator.allocate(request.toDocument("queue"));
        request.setHospitalizationId(correlationId.getValue());

        rabbitTemplate.convertAndSend(exchange, routingKey, objectMapper.writeValueAsString(request));
        log.info("Queued note for hospitalization {}", correlationId);

        Map<String, String> body = new HashMap<>();
        body.put("status", "Accepted");
        body.put("hospitalizationId", correlationId.getValue());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/{hospitalizationId}")
    @Operation(summary = "Whether a note for this hospitalization is being processed")
    public ResponseEntity<Map<String, Object>> status(@PathVariable String hospitalizationId) {
        Map<String, Object> body = new HashMap<>();
        body.put("hospitalizationId", hospitalizationId);
        body.put("processing", handler.isProcessing(hospitalizationId));
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{hospitalizationId}")
    @Operation(summary = "Cancel in-flight processing for one hospitalization")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String hospitalizationId) {
        if (!handler.cancel(hospitalizationId)) {
            throw new SummaryNotFoundException("No processing in flight for hospitalization " + hospitalizationId);
        }
        Map<String, String> body = new HashMap<>();
        body.put("status", "Cancelling");
        body.put("hospitalizationId", hospitalizationId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    static int statusFor(ExtractionReport report) {
        switch (report.getStatus()) {
            case SUCCESS:
                return HttpStatus.OK.value();
            case PARTIAL:
                return MULTI_STATUS;
            case CANCELLED:
                return HttpStatus.CONFLICT.value();
            default:
                return HttpStatus.UNPROCESSABLE_ENTITY.value();
        }
    }
}
