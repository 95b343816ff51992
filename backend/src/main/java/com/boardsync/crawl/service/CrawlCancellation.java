package com.boardsync.crawl.service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation token shared by the orchestrator and all in-flight work of one run.
 */
public class CrawlCancellation {
    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel(String why) {
        reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
