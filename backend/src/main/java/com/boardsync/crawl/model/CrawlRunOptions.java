package com.boardsync.crawl.model;

public record CrawlRunOptions(Integer employerBatchSize, Boolean resume) {
    public static CrawlRunOptions defaults() {
        return new CrawlRunOptions(null, null);
    }
}
