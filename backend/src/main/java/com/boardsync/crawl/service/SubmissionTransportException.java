package com.boardsync.crawl.service;

/**
 * The downstream API could not be reached or answered with something unusable. Retryable.
 */
public class SubmissionTransportException extends RuntimeException {
    public SubmissionTransportException(String message) {
        super(message);
    }

    public SubmissionTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
