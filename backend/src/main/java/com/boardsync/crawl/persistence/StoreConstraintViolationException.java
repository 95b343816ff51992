package com.boardsync.crawl.persistence;

/**
 * Raised when an insert collides with the unique source URL constraint. Reaching this means the caller's
 * find-before-insert check was bypassed.
 */
public class StoreConstraintViolationException extends RuntimeException {
    private final String sourceUrl;

    public StoreConstraintViolationException(String sourceUrl, Throwable cause) {
        super("Duplicate source_url rejected by store: " + sourceUrl, cause);
        this.sourceUrl = sourceUrl;
    }

    public String getSourceUrl() {
        return sourceUrl;
    }
}
