package com.boardsync.crawl.render;

import com.boardsync.crawl.model.RenderedPage;

import java.time.Duration;

/**
 * Turns a URL into raw page content. Implementations must not share mutable page state between calls.
 */
public interface PageRenderer {
    RenderedPage render(String url, Duration timeout);
}
