package com.boardsync.crawl.jobs;

import com.boardsync.crawl.model.ExtractionMetricsSnapshot;

import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-run counters for the extraction step. Shared by the extraction workers of one run.
 */
public class ExtractionMetrics {
    private final double costPerThousandTokens;
    private final LongAdder pagesRendered = new LongAdder();
    private final LongAdder renderFailures = new LongAdder();
    private final LongAdder aiCalls = new LongAdder();
    private final LongAdder aiSuccesses = new LongAdder();
    private final LongAdder aiFailures = new LongAdder();
    private final LongAdder fallbackExtractions = new LongAdder();
    private final LongAdder geographyRejections = new LongAdder();
    private final LongAdder employmentTypeRejections = new LongAdder();
    private final LongAdder totalTokens = new LongAdder();
    private final DoubleAdder estimatedCostUsd = new DoubleAdder();
    private final LongAdder extractionMillis = new LongAdder();

    public ExtractionMetrics(double costPerThousandTokens) {
        this.costPerThousandTokens = Math.max(0.0, costPerThousandTokens);
    }

    public void pageRendered() {
        pagesRendered.increment();
    }

    public void renderFailed() {
        renderFailures.increment();
    }

    public void aiCalled() {
        aiCalls.increment();
    }

    public void aiSucceeded(long tokens) {
        aiSuccesses.increment();
        if (tokens > 0) {
            totalTokens.add(tokens);
            estimatedCostUsd.add(tokens / 1000.0 * costPerThousandTokens);
        }
    }

    public void aiFailed() {
        aiFailures.increment();
    }

    public void fallbackUsed() {
        fallbackExtractions.increment();
    }

    public void geographyRejected() {
        geographyRejections.increment();
    }

    public void employmentTypeRejected() {
        employmentTypeRejections.increment();
    }

    public void addExtractionMillis(long millis) {
        extractionMillis.add(Math.max(0L, millis));
    }

    public ExtractionMetricsSnapshot snapshot() {
        return new ExtractionMetricsSnapshot(
            pagesRendered.sum(),
            renderFailures.sum(),
            aiCalls.sum(),
            aiSuccesses.sum(),
            aiFailures.sum(),
            fallbackExtractions.sum(),
            geographyRejections.sum(),
            employmentTypeRejections.sum(),
            totalTokens.sum(),
            estimatedCostUsd.sum(),
            extractionMillis.sum()
        );
    }
}
