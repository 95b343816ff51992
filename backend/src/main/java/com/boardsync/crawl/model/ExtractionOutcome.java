package com.boardsync.crawl.model;

public record ExtractionOutcome(Status status, JobRecord candidate, String reason) {
    public enum Status {
        EXTRACTED,
        REJECTED,
        FAILED
    }

    public static ExtractionOutcome extracted(JobRecord candidate) {
        return new ExtractionOutcome(Status.EXTRACTED, candidate, null);
    }

    public static ExtractionOutcome rejected(String reason) {
        return new ExtractionOutcome(Status.REJECTED, null, reason);
    }

    public static ExtractionOutcome failed(String reason) {
        return new ExtractionOutcome(Status.FAILED, null, reason);
    }

    public boolean isExtracted() {
        return status == Status.EXTRACTED;
    }
}
