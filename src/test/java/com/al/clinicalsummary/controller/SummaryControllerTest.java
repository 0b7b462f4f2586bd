package com.al.clinicalsummary.controller;

import com.al.clinicalsummary.exception.GlobalExceptionHandler;
import com.al.clinicalsummary.model.HospitalSummaryRecord;
import com.al.clinicalsummary.repository.ClinicalSummaryRepository;
import com.al.clinicalsummary.repository.HospitalSummaryRepository;
import com.al.clinicalsummary.service.SummaryQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

public class SummaryControllerTest {

    private MockMvc mockMvc;

    @Mock
    private HospitalSummaryRepository hospitalRepository;

    @Mock
    private ClinicalSummaryRepository clinicalRepository;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        SummaryController controller = new SummaryController(
                new SummaryQueryService(hospitalRepository, clinicalRepository));
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static HospitalSummaryRecord record(String hospitalizationId) {
        HospitalSummaryRecord record = new HospitalSummaryRecord();
        record.setId("rec-" + hospitalizationId);
        record.setHospitalizationId(hospitalizationId);
        record.setPatientId("P-1");
        record.setLengthOfStayDays(4);
        return record;
    }

    @Test
    public void testGetHospitalSummary() throws Exception {
        when(hospitalRepository.findByHospitalizationId("H-1")).thenReturn(Optional.of(record("H-1")));

        mockMvc.perform(get("/api/summaries/hospital/H-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hospitalization_id").value("H-1"))
                .andExpect(jsonPath("$.length_of_stay_days").value(4));
    }

    @Test
    public void testGetClinicalSummary_NotFound() throws Exception {
        when(clinicalRepository.findByHospitalizationId("H-2")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/summaries/clinical/H-2"))
                .andExpect(status().isNotFound());
    }

    @Test
    public void testListHospitalSummaries() throws Exception {
        when(hospitalRepository.findTop10ByPatientIdOrderByCreatedAtDesc("P-1"))
                .thenReturn(List.of(record("H-2"), record("H-1")));

        mockMvc.perform(get("/api/summaries/hospital").param("patientId", "P-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].hospitalization_id").value("H-2"));
    }

    @Test
    public void testDeleteSummaries() throws Exception {
        when(hospitalRepository.deleteByHospitalizationId("H-1")).thenReturn(1L);
        when(clinicalRepository.deleteByHospitalizationId("H-1")).thenReturn(1L);

        mockMvc.perform(delete("/api/summaries/H-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(2));
    }

    @Test
    public void testDeleteSummaries_NothingStored() throws Exception {
        mockMvc.perform(delete("/api/summaries/H-9"))
                .andExpect(status().isNotFound());
    }
}
