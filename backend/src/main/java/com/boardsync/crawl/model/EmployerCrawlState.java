package com.boardsync.crawl.model;

public record EmployerCrawlState(String employerName, int totalJobs, int completeJobs, int incompleteJobs) {
    public static EmployerCrawlState empty(String employerName) {
        return new EmployerCrawlState(employerName, 0, 0, 0);
    }
}
