package com.boardsync.crawl.model;

public record ExtractionMetricsSnapshot(
    long pagesRendered,
    long renderFailures,
    long aiCalls,
    long aiSuccesses,
    long aiFailures,
    long fallbackExtractions,
    long geographyRejections,
    long employmentTypeRejections,
    long totalTokens,
    double estimatedCostUsd,
    long extractionMillis
) {
}
