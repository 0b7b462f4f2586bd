package com.al.clinicalsummary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClinicalSummaryExtractorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicalSummaryExtractorApplication.class, args);
    }
}
