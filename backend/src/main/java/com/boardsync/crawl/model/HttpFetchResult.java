package com.boardsync.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isTimeout() {
        return "timeout".equals(errorCode) || statusCode == 408;
    }

    public boolean isTransportFailure() {
        if (errorCode != null) {
            return true;
        }
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
