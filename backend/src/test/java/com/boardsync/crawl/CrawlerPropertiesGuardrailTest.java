package com.boardsync.crawl;

import com.boardsync.config.CrawlerProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("board-sync/0.1"));
    }

    @Test
    void concurrencyAndDelayAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(0);
        properties.setPerHostDelayMs(-10);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getPerHostDelayMs());
    }

    @Test
    void batchSizesAndRenderTimeoutsAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getRun().setEmployerBatchSize(0);
        properties.getSubmission().setBatchSize(-3);
        properties.getSubmission().setMaxAttempts(0);
        properties.getRender().setTimeoutSeconds(45);
        properties.getRender().setRetryTimeoutSeconds(10);

        assertEquals(1, properties.getRun().getEmployerBatchSize());
        assertEquals(1, properties.getSubmission().getBatchSize());
        assertEquals(1, properties.getSubmission().getMaxAttempts());
        assertEquals(45, properties.getRender().getRetryTimeoutSeconds());
    }
}
