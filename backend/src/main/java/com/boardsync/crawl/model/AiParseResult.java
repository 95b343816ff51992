package com.boardsync.crawl.model;

public record AiParseResult(JobFields fields, long totalTokens) {
}
