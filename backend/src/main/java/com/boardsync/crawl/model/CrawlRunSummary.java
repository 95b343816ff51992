package com.boardsync.crawl.model;

import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    long crawlRunId,
    Instant startedAt,
    Instant finishedAt,
    String status,
    RunPhase finalPhase,
    RunTotals totals,
    ExtractionMetricsSnapshot extraction,
    List<EmployerCrawlSummary> employers) {}
