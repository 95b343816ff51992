package com.boardsync.crawl.model;

import java.util.Map;

public record EmployerCrawlSummary(
    String employerName,
    CrawlAction action,
    String reason,
    int urlsCollected,
    int inserted,
    int updated,
    int skipped,
    int rejected,
    int failed,
    boolean employerFailed,
    boolean aborted,
    Map<String, Integer> topErrors
) {
    public static EmployerCrawlSummary skipped(String employerName, String reason) {
        return new EmployerCrawlSummary(employerName, CrawlAction.SKIP, reason, 0, 0, 0, 0, 0, 0, false, false, Map.of());
    }

    public int forwarded() {
        return inserted + updated;
    }
}
