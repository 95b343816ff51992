package com.boardsync.crawl.jobs;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.ats.AtsPlatform;
import com.boardsync.crawl.ats.AtsPlatformRegistry;
import com.boardsync.crawl.model.EmployerTarget;
import com.boardsync.crawl.model.RenderedPage;
import com.boardsync.crawl.render.PageLoader;
import com.boardsync.crawl.render.RenderException;
import com.boardsync.crawl.util.JobUrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates job-posting URLs from an employer's listing pages. Listing pages are rendered only as the stream is
 * consumed. URLs are de-duplicated by their normalized form within one collection pass.
 */
@Component
public class JobUrlCollector {
    private static final Logger log = LoggerFactory.getLogger(JobUrlCollector.class);

    private final PageLoader pageLoader;
    private final AtsPlatformRegistry platformRegistry;
    private final CrawlerProperties properties;

    public JobUrlCollector(PageLoader pageLoader, AtsPlatformRegistry platformRegistry, CrawlerProperties properties) {
        this.pageLoader = pageLoader;
        this.platformRegistry = platformRegistry;
        this.properties = properties;
    }

    /**
     * Lazily yields the employer's job URLs. Consuming the stream throws {@link CollectionException} when no
     * listing page could be rendered or none contained a recognizable job link.
     */
    public Stream<String> collect(EmployerTarget employer) {
        Iterator<String> iterator = new ListingIterator(employer, properties.getExtraction().getMaxJobPages());
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL),
            false
        );
    }

    private final class ListingIterator implements Iterator<String> {
        private final EmployerTarget employer;
        private final int limit;
        private final Deque<String> pendingListings;
        private final Deque<String> buffer = new ArrayDeque<>();
        private final Set<String> seen = new HashSet<>();
        private int emitted;
        private String lastFailure;

        private ListingIterator(EmployerTarget employer, int limit) {
            this.employer = employer;
            this.limit = limit;
            this.pendingListings = new ArrayDeque<>(employer.listingUrls());
        }

        @Override
        public boolean hasNext() {
            if (emitted >= limit) {
                return false;
            }
            while (buffer.isEmpty() && !pendingListings.isEmpty()) {
                loadListing(pendingListings.poll());
            }
            if (!buffer.isEmpty()) {
                return true;
            }
            if (emitted == 0) {
                String reason = lastFailure == null ? "no_job_links" : lastFailure;
                throw new CollectionException(employer.name(), "No job URLs collected for " + employer.name() + ": " + reason);
            }
            return false;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            emitted++;
            return buffer.poll();
        }

        private void loadListing(String listingUrl) {
            RenderedPage page;
            try {
                page = pageLoader.load(listingUrl);
            } catch (RenderException e) {
                lastFailure = "listing_render_failed";
                log.warn("Listing page {} for {} could not be rendered: {}", listingUrl, employer.name(), e.getMessage());
                return;
            }
            String baseUrl = page.finalUrl() == null ? listingUrl : page.finalUrl();
            Document document = Jsoup.parse(page.html(), baseUrl);
            AtsPlatform platform = platformRegistry.forPage(listingUrl, page.html());
            List<String> links = platform.collectUrls(document, baseUrl);
            int added = 0;
            for (String link : links) {
                String normalized = JobUrlUtils.normalize(link);
                if (normalized != null && seen.add(normalized)) {
                    buffer.add(normalized);
                    added++;
                }
            }
            log.info("Listing {} ({}) yielded {} new job links for {}", listingUrl, platform.type(), added, employer.name());
        }
    }
}
