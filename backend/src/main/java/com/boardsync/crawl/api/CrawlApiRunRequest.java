package com.boardsync.crawl.api;

public record CrawlApiRunRequest(Integer employerBatchSize, Boolean resume) {
}
