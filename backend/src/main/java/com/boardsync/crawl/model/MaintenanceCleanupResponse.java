package com.boardsync.crawl.model;

import java.util.Map;

public record MaintenanceCleanupResponse(
    int scanned,
    int rejected,
    int deleted,
    boolean dryRun,
    long lastId,
    Map<String, Integer> rejectionReasons
) {
}
