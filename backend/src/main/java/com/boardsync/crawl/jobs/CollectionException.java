package com.boardsync.crawl.jobs;

public class CollectionException extends RuntimeException {
    private final String employerName;

    public CollectionException(String employerName, String message) {
        super(message);
        this.employerName = employerName;
    }

    public CollectionException(String employerName, String message, Throwable cause) {
        super(message, cause);
        this.employerName = employerName;
    }

    public String getEmployerName() {
        return employerName;
    }
}
