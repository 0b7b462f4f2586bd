package com.al.clinicalsummary.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for per-document work. Extractor and persistence tasks never wait on each other,
 * so they share one pool; whole documents in a batch run on a separate pool so that a document
 * waiting on its extractors can never starve them.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(ExtractionProperties properties) {
        int threads = properties.resolveWorkerThreads();
        log.info("Extraction executor initialized with {} threads", threads);
        return new MdcPropagatingExecutorService(Executors.newFixedThreadPool(threads, namedThreads("extract-")));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService documentExecutor() {
        int threads = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        log.info("Document executor initialized with {} threads", threads);
        return new MdcPropagatingExecutorService(Executors.newFixedThreadPool(threads, namedThreads("document-")));
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
