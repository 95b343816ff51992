package com.boardsync.crawl.model;

import java.util.List;

public record PipelineBatchResponse(Integer created, Integer skipped, List<RejectedJob> rejected) {
    public int createdCount() {
        return created == null ? 0 : created;
    }

    public int skippedCount() {
        return skipped == null ? 0 : skipped;
    }

    public List<RejectedJob> rejectedJobs() {
        return rejected == null ? List.of() : rejected;
    }
}
