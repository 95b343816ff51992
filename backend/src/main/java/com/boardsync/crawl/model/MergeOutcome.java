package com.boardsync.crawl.model;

public enum MergeOutcome {
    INSERT,
    UPDATE,
    SKIP;

    public boolean forwarded() {
        return this != SKIP;
    }
}
