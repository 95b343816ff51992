package com.boardsync.crawl.model;

public enum RunPhase {
    IDLE,
    SELECTING_EMPLOYER,
    CRAWLING_EMPLOYER,
    SUBMITTING,
    CHECKPOINTING,
    DONE,
    INTERRUPTED
}
