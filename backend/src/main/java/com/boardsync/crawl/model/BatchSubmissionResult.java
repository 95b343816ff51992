package com.boardsync.crawl.model;

import java.util.List;

public record BatchSubmissionResult(
    int size,
    int attempts,
    int created,
    int skipped,
    List<RejectedJob> rejected,
    boolean failed,
    String error
) {
    public static BatchSubmissionResult delivered(int size, int attempts, PipelineBatchResponse response) {
        return new BatchSubmissionResult(
            size,
            attempts,
            response.createdCount(),
            response.skippedCount(),
            response.rejectedJobs(),
            false,
            null
        );
    }

    public static BatchSubmissionResult failed(int size, int attempts, String error) {
        return new BatchSubmissionResult(size, attempts, 0, 0, List.of(), true, error);
    }

    public static BatchSubmissionResult rejectedAll(int size, int attempts, List<RejectedJob> rejected, String error) {
        return new BatchSubmissionResult(size, attempts, 0, 0, rejected, false, error);
    }
}
