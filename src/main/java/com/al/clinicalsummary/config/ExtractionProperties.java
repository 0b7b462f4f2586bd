package com.al.clinicalsummary.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Settings for extraction, orchestration and the LLM behind the extractors.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app.extraction")
public class ExtractionProperties {

    /**
     * Upper bound for a single extractor call. A stalled extractor is reported as timed out
     * and never holds back its siblings longer than this.
     */
    private Duration extractorTimeout = Duration.ofSeconds(180);

    /**
     * Upper bound for a single summary write.
     */
    private Duration persistenceTimeout = Duration.ofSeconds(30);

    /**
     * Worker threads shared by extractor and persistence tasks; 0 picks a size from the CPU count.
     */
    private int workerThreads = 0;

    private Llm llm = new Llm();

    public int resolveWorkerThreads() {
        if (workerThreads > 0) {
            return workerThreads;
        }
        return Math.max(4, Runtime.getRuntime().availableProcessors()) * 2;
    }

    @Data
    public static class Llm {
        private String modelName = "gpt-4o-mini";
        private String apiKey;
        private String baseUrl;
        private double temperature = 0.0;
        private int maxRetries = 2;
        private Duration timeout = Duration.ofSeconds(180);
    }
}
