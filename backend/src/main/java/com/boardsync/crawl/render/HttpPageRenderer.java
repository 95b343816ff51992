package com.boardsync.crawl.render;

import com.boardsync.crawl.http.PoliteHttpClient;
import com.boardsync.crawl.model.HttpFetchResult;
import com.boardsync.crawl.model.RenderedPage;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

@Component
public class HttpPageRenderer implements PageRenderer {
    private static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;

    public HttpPageRenderer(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public RenderedPage render(String url, Duration timeout) {
        HttpFetchResult fetch = httpClient.get(url, HTML_ACCEPT, Map.of(), timeout, 1);
        if (fetch == null) {
            throw new RenderException(url, "no_response", true);
        }
        if (fetch.isTimeout()) {
            throw new RenderException(url, "timeout", true);
        }
        if (fetch.errorCode() != null) {
            throw new RenderException(url, fetch.errorCode() + ": " + fetch.errorMessage(), false);
        }
        if (!fetch.isSuccessful()) {
            throw new RenderException(url, "http_" + fetch.statusCode(), fetch.statusCode() >= 500);
        }
        if (fetch.body() == null || fetch.body().isBlank()) {
            throw new RenderException(url, "empty_content", true);
        }
        return new RenderedPage(url, fetch.finalUrlOrRequested(), fetch.body());
    }
}
