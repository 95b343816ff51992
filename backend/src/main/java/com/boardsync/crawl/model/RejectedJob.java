package com.boardsync.crawl.model;

public record RejectedJob(String url, String reason) {
}
