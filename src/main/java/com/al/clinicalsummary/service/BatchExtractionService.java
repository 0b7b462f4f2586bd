package com.al.clinicalsummary.service;

import com.al.clinicalsummary.dto.BatchExtractionResponse;
import com.al.clinicalsummary.dto.BatchExtractionResponse.DocumentError;
import com.al.clinicalsummary.dto.ExtractionReport;
import com.al.clinicalsummary.model.ClinicalDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Service for batch extraction with documents processed in parallel.
 *
 * <p>
 * Each document runs through {@link SummaryExtractionHandler} on its own; a failed or cancelled
 * document never affects the others in the batch.
 */
@Service
@Slf4j
public class BatchExtractionService {

    private final SummaryExtractionHandler handler;
    private final ExecutorService executorService;

    @Autowired
    public BatchExtractionService(SummaryExtractionHandler handler,
            @Qualifier("documentExecutor") ExecutorService executorService) {
        this.handler = handler;
        this.executorService = executorService;
    }

    /**
     * Process multiple documents in parallel.
     *
     * @param documents documents in submission order
     * @return BatchExtractionResponse with one report per processed document and errors for the rest
     */
    public BatchExtractionResponse processBatch(List<ClinicalDocument> documents) {
        Map<Integer, ClinicalDocument> indexed = new LinkedHashMap<>();
        for (int i = 0; i < documents.size(); i++) {
            indexed.put(i, documents.get(i));
        }
        return run(indexed, documents.size(), new ArrayList<>());
    }

    /**
     * Process every {@code *.txt} file in a directory, in file name order. Each note gets a
     * freshly generated hospitalization id.
     */
    public BatchExtractionResponse processDirectory(Path directory, String patientId) throws IOException {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        log.info("Found {} note files in {}", files.size(), directory);

        Map<Integer, ClinicalDocument> indexed = new LinkedHashMap<>();
        List<DocumentError> readErrors = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            try {
                indexed.put(i, ClinicalDocument.builder()
                        .text(Files.readString(file, StandardCharsets.UTF_8))
                        .patientId(patientId)
                        .source(file.getFileName().toString())
                        .build());
            } catch (IOException e) {
                log.error("Could not read note file {}: {}", file, e.getMessage());
                readErrors.add(new DocumentError(i, file.getFileName().toString(), "Unreadable file: " + e.getMessage()));
            }
        }
        return run(indexed, files.size(), readErrors);
    }

    private BatchExtractionResponse run(Map<Integer, ClinicalDocument> documents, int total,
            List<DocumentError> errors) {
        long startTime = System.currentTimeMillis();
        log.info("Starting batch extraction: {} documents", documents.size());

        BatchExtractionResponse response = new BatchExtractionResponse();
        response.setTotalDocuments(total);
        response.setErrors(errors);

        Map<Integer, CompletableFuture<ExtractionReport>> futures = new LinkedHashMap<>();
        documents.forEach((index, document) -> futures.put(index,
                CompletableFuture.supplyAsync(() -> handler.process(document), executorService)));

        futures.forEach((index, future) -> {
            ClinicalDocument document = documents.get(index);
            try {
                ExtractionReport report = future.join();
                response.getResults().add(report);
                switch (report.getStatus()) {
                    case SUCCESS:
                        response.setSuccessCount(response.getSuccessCount() + 1);
                        break;
                    case PARTIAL:
                        response.setPartialCount(response.getPartialCount() + 1);
                        break;
                    default:
                        response.setFailureCount(response.getFailureCount() + 1);
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Document {} ({}) was not processed: {}", index, document.getSource(), cause.getMessage());
                response.getErrors().add(new DocumentError(index, document.getSource(), cause.getMessage()));
                response.setFailureCount(response.getFailureCount() + 1);
            }
        });
        response.setFailureCount(response.getFailureCount() + (total - documents.size()));
        response.setProcessingTimeMs(System.currentTimeMillis() - startTime);

        log.info("Batch extraction completed: {} success, {} partial, {} failures, {}ms total",
                response.getSuccessCount(), response.getPartialCount(), response.getFailureCount(),
                response.getProcessingTimeMs());
        return response;
    }
}
