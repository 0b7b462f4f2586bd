package com.al.clinicalsummary.controller;

import com.al.clinicalsummary.dto.BatchExtractionResponse;
import com.al.clinicalsummary.dto.ExtractionReport;
import com.al.clinicalsummary.dto.PersistenceOutcome;
import com.al.clinicalsummary.exception.DuplicateProcessingException;
import com.al.clinicalsummary.exception.GlobalExceptionHandler;
import com.al.clinicalsummary.model.ClinicalDocument;
import com.al.clinicalsummary.model.enums.ProcessingStatus;
import com.al.clinicalsummary.model.enums.SummaryGroup;
import com.al.clinicalsummary.service.BatchExtractionService;
import com.al.clinicalsummary.service.CorrelationIdAllocator;
import com.al.clinicalsummary.service.SummaryExtractionHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class ExtractionControllerTest {

    private static final String BODY = "{\"patientId\": \"P-1\", \"hospitalizationId\": \"H-1\", \"text\": \"Admitted for syncope.\"}";

    private MockMvc mockMvc;

    @Mock
    private SummaryExtractionHandler handler;

    @Mock
    private BatchExtractionService batchExtractionService;

    @Mock
    private RabbitTemplate rabbitTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        ExtractionController controller = new ExtractionController(handler, batchExtractionService,
                new CorrelationIdAllocator(), rabbitTemplate, objectMapper);
        ReflectionTestUtils.setField(controller, "exchange", "test-exchange");
        ReflectionTestUtils.setField(controller, "routingKey", "test-routing-key");

        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static ExtractionReport report(ProcessingStatus status, String message) {
        return ExtractionReport.builder()
                .hospitalizationId("H-1")
                .patientId("P-1")
                .status(status)
                .message(message)
                .clinical(PersistenceOutcome.persisted(SummaryGroup.CLINICAL, "c-1"))
                .hospital(PersistenceOutcome.failed(SummaryGroup.HOSPITAL, "missing diagnosis"))
                .build();
    }

    @Test
    public void testExtract_Success() throws Exception {
        when(handler.process(any())).thenReturn(report(ProcessingStatus.SUCCESS, "clinical summary saved, hospital summary saved"));

        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.hospitalizationId").value("H-1"));

        ArgumentCaptor<ClinicalDocument> captor = ArgumentCaptor.forClass(ClinicalDocument.class);
        verify(handler).process(captor.capture());
        assertEquals("H-1", captor.getValue().getHospitalizationId());
        assertEquals("Admitted for syncope.", captor.getValue().getText());
    }

    @Test
    public void testExtract_PartialIsMultiStatus() throws Exception {
        when(handler.process(any())).thenReturn(
                report(ProcessingStatus.PARTIAL, "clinical summary saved, hospital summary failed: missing diagnosis"));

        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().is(207))
                .andExpect(jsonPath("$.message").value("clinical summary saved, hospital summary failed: missing diagnosis"));
    }

    @Test
    public void testExtract_FailureIsUnprocessable() throws Exception {
        when(handler.process(any())).thenReturn(report(ProcessingStatus.FAILED, "both failed"));

        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    public void testExtract_MissingPatientIdRejected() throws Exception {
        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"note\"}"))
                .andExpect(status().isBadRequest());

        verify(handler, never()).process(any());
    }

    @Test
    public void testExtract_DuplicateIsConflict() throws Exception {
        when(handler.process(any())).thenThrow(new DuplicateProcessingException("H-1"));

        mockMvc.perform(post("/api/extractions").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isConflict());
    }

    @Test
    public void testExtractAsync_QueuesWithHospitalizationId() throws Exception {
        mockMvc.perform(post("/api/extractions/async").contentType(MediaType.APPLICATION_JSON)
                .content("{\"patientId\": \"P-1\", \"text\": \"note\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("Accepted"))
                .andExpect(jsonPath("$.hospitalizationId").exists());

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(rabbitTemplate).convertAndSend(eq("test-exchange"), eq("test-routing-key"), payload.capture());
        assertTrue(payload.getValue().toString().contains("\"hospitalizationId\":\""));
    }

    @Test
    public void testExtractBatch() throws Exception {
        BatchExtractionResponse response = new BatchExtractionResponse();
        response.setTotalDocuments(2);
        response.setSuccessCount(2);
        when(batchExtractionService.processBatch(anyList())).thenReturn(response);

        mockMvc.perform(post("/api/extractions/batch").contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\": [" + BODY + ", {\"patientId\": \"P-2\", \"text\": \"\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.successCount").value(2));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ClinicalDocument>> captor = ArgumentCaptor.forClass(List.class);
        verify(batchExtractionService).processBatch(captor.capture());
        assertEquals(2, captor.getValue().size());
        assertEquals("batch", captor.getValue().get(0).getSource());
    }

    @Test
    public void testExtractBatch_EmptyRejected() throws Exception {
        mockMvc.perform(post("/api/extractions/batch").contentType(MediaType.APPLICATION_JSON)
                .content("{\"documents\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testCancel() throws Exception {
        when(handler.cancel("H-1")).thenReturn(true);

        mockMvc.perform(delete("/api/extractions/H-1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("Cancelling"));
    }

    @Test
    public void testCancel_NothingInFlight() throws Exception {
        mockMvc.perform(delete("/api/extractions/H-unknown"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void testStatus() throws Exception {
        when(handler.isProcessing("H-1")).thenReturn(true);

        mockMvc.perform(get("/api/extractions/H-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processing").value(true));
    }
}
