package com.boardsync.crawl.model;

public record CrawlProgressView(RunPhase phase, Long activeCrawlRunId, String currentEmployer, RunProgress progress) {}
