package com.boardsync.crawl.service;

/**
 * The downstream API refused the whole request. Not retried.
 */
public class SubmissionRejectedException extends RuntimeException {
    private final int statusCode;

    public SubmissionRejectedException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
