package com.boardsync.crawl.render;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.model.RenderedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Renders a page with the configured timeout and, on a timeout or empty page, once more with the longer
 * retry timeout.
 */
@Component
public class PageLoader {
    private static final Logger log = LoggerFactory.getLogger(PageLoader.class);

    private final PageRenderer renderer;
    private final CrawlerProperties properties;

    public PageLoader(PageRenderer renderer, CrawlerProperties properties) {
        this.renderer = renderer;
        this.properties = properties;
    }

    public RenderedPage load(String url) {
        Duration first = Duration.ofSeconds(properties.getRender().getTimeoutSeconds());
        try {
            return renderer.render(url, first);
        } catch (RenderException e) {
            if (!e.isRetryable()) {
                throw e;
            }
            Duration retry = Duration.ofSeconds(properties.getRender().getRetryTimeoutSeconds());
            log.debug("Render of {} failed ({}), retrying with timeout {}", url, e.getMessage(), retry);
            return renderer.render(url, retry);
        }
    }
}
