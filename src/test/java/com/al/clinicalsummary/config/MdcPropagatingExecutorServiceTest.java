package com.al.clinicalsummary.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class MdcPropagatingExecutorServiceTest {

    private final ExecutorService executor = new MdcPropagatingExecutorService(Executors.newSingleThreadExecutor());

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    @Test
    public void testSubmit_PropagatesAndClearsMdc() throws Exception {
        MDC.put("correlationId", "H-42");
        assertEquals("H-42", executor.submit(() -> MDC.get("correlationId")).get(1, TimeUnit.SECONDS));

        MDC.clear();
        assertNull(executor.submit(() -> MDC.get("correlationId")).get(1, TimeUnit.SECONDS));
    }

    @Test
    public void testResolveWorkerThreads() {
        ExtractionProperties properties = new ExtractionProperties();
        assertTrue(properties.resolveWorkerThreads() >= 8);

        properties.setWorkerThreads(3);
        assertEquals(3, properties.resolveWorkerThreads());
    }
}
