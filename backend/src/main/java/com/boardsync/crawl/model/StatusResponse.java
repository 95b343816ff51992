package com.boardsync.crawl.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> counts,
    CrawlRunMeta mostRecentCrawlRun,
    Boolean downstreamHealthy) {}
