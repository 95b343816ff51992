package com.boardsync.crawl.model;

public record RenderedPage(String requestedUrl, String finalUrl, String html) {
}
