package com.boardsync.crawl.model;

public record RunTotals(
    int employersProcessed,
    int employersSkipped,
    int employersFailed,
    int collected,
    int inserted,
    int updated,
    int skipped,
    int rejected,
    int failed,
    int delivered,
    int downstreamRejected,
    int failedBatches
) {
}
