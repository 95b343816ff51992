package com.boardsync.crawl.model;

public record MergeResult(MergeOutcome outcome, JobRecord record, String reason) {
    public boolean forwarded() {
        return outcome.forwarded();
    }
}
