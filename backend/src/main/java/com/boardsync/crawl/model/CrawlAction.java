package com.boardsync.crawl.model;

public enum CrawlAction {
    SKIP,
    FULL_CRAWL
}
