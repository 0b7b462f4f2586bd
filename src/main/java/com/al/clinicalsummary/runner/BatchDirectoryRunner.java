package com.al.clinicalsummary.runner;

import com.al.clinicalsummary.dto.BatchExtractionResponse;
import com.al.clinicalsummary.service.BatchExtractionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Processes a directory of notes once at startup when {@code app.batch.input-dir} is set.
 */
@Component
@ConditionalOnProperty(prefix = "app.batch", name = "input-dir")
@Slf4j
public class BatchDirectoryRunner implements ApplicationRunner {

    private final BatchExtractionService batchExtractionService;
    private final String inputDir;
    private final String patientId;

    public BatchDirectoryRunner(BatchExtractionService batchExtractionService,
            @Value("${app.batch.input-dir}") String inputDir,
            @Value("${app.batch.patient-id:}") String patientId) {
        this.batchExtractionService = batchExtractionService;
        this.inputDir = inputDir;
        this.patientId = patientId;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        Path directory = Paths.get(inputDir);
        if (!Files.isDirectory(directory)) {
            throw new IllegalStateException("app.batch.input-dir is not a directory: " + directory);
        }
        if (patientId == null || patientId.isBlank()) {
            throw new IllegalStateException("app.batch.patient-id is required when app.batch.input-dir is set");
        }

        BatchExtractionResponse response = batchExtractionService.processDirectory(directory, patientId);
        log.info("Startup batch over {} finished: {} documents, {} success, {} partial, {} failures",
                directory, response.getTotalDocuments(), response.getSuccessCount(), response.getPartialCount(),
                response.getFailureCount());
        response.getErrors().forEach(error -> log.warn("Note {} ({}) not processed: {}", error.getIndex(),
                error.getSource(), error.getMessage()));
    }
}
