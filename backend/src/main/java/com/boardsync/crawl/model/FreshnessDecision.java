package com.boardsync.crawl.model;

public record FreshnessDecision(CrawlAction action, String reason, EmployerCrawlState state) {
    public static FreshnessDecision skip(EmployerCrawlState state, String reason) {
        return new FreshnessDecision(CrawlAction.SKIP, reason, state);
    }

    public static FreshnessDecision fullCrawl(EmployerCrawlState state, String reason) {
        return new FreshnessDecision(CrawlAction.FULL_CRAWL, reason, state);
    }

    public boolean isSkip() {
        return action == CrawlAction.SKIP;
    }
}
