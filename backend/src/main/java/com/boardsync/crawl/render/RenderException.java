package com.boardsync.crawl.render;

public class RenderException extends RuntimeException {
    private final String url;
    private final boolean retryable;

    public RenderException(String url, String message, boolean retryable) {
        super(message);
        this.url = url;
        this.retryable = retryable;
    }

    public String getUrl() {
        return url;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
