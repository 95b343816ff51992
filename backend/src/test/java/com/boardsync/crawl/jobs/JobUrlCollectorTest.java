package com.boardsync.crawl.jobs;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.ats.AtsDetector;
import com.boardsync.crawl.ats.AtsPlatformRegistry;
import com.boardsync.crawl.ats.AshbyPlatform;
import com.boardsync.crawl.ats.GenericPlatform;
import com.boardsync.crawl.ats.GreenhousePlatform;
import com.boardsync.crawl.ats.LeverPlatform;
import com.boardsync.crawl.ats.SmartRecruitersPlatform;
import com.boardsync.crawl.ats.WorkablePlatform;
import com.boardsync.crawl.ats.WorkdayPlatform;
import com.boardsync.crawl.model.EmployerTarget;
import com.boardsync.crawl.model.RenderedPage;
import com.boardsync.crawl.render.PageLoader;
import com.boardsync.crawl.render.RenderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobUrlCollectorTest {
    private static final String GREENHOUSE_LISTING = "https://boards.greenhouse.io/acme";
    private static final String CAREERS_LISTING = "https://acme.com/careers";

    @Mock
    private PageLoader pageLoader;

    private CrawlerProperties properties;
    private JobUrlCollector collector;

    @BeforeEach
    void setUp() {
        properties = new CrawlerProperties();
        AtsPlatformRegistry registry = new AtsPlatformRegistry(new AtsDetector(), List.of(
            new GreenhousePlatform(),
            new LeverPlatform(),
            new AshbyPlatform(),
            new WorkdayPlatform(),
            new SmartRecruitersPlatform(),
            new WorkablePlatform(),
            new GenericPlatform()
        ));
        collector = new JobUrlCollector(pageLoader, registry, properties);
    }

    @Test
    void collectsNormalizedJobLinksOnceAcrossListings() {
        when(pageLoader.load(GREENHOUSE_LISTING)).thenReturn(page(GREENHOUSE_LISTING, """
            <html><body>
              <a href="/acme/jobs/101">Backend Engineer</a>
              <a href="/acme/jobs/101?utm_source=linkedin">Backend Engineer (again)</a>
              <a href="https://boards.greenhouse.io/acme/jobs/102/">Data Engineer</a>
              <a href="/acme">All jobs</a>
              <a href="#top">Top</a>
            </body></html>
            """));
        when(pageLoader.load(CAREERS_LISTING)).thenReturn(page(CAREERS_LISTING, """
            <html><body>
              <a href="https://boards.greenhouse.io/acme/jobs/102">Data Engineer</a>
              <a href="/careers/jobs/site-reliability-engineer">SRE</a>
              <a href="/about">About</a>
            </body></html>
            """));

        List<String> urls;
        try (Stream<String> stream = collector.collect(new EmployerTarget("Acme", List.of(GREENHOUSE_LISTING, CAREERS_LISTING)))) {
            urls = stream.toList();
        }

        assertThat(urls).containsExactly(
            "https://boards.greenhouse.io/acme/jobs/101",
            "https://boards.greenhouse.io/acme/jobs/102",
            "https://acme.com/careers/jobs/site-reliability-engineer"
        );
    }

    @Test
    void stopsAtTheConfiguredPageLimitWithoutRenderingFurtherListings() {
        properties.getExtraction().setMaxJobPages(1);
        when(pageLoader.load(GREENHOUSE_LISTING)).thenReturn(page(GREENHOUSE_LISTING, """
            <html><body>
              <a href="/acme/jobs/101">One</a>
              <a href="/acme/jobs/102">Two</a>
            </body></html>
            """));

        List<String> urls = collector.collect(new EmployerTarget("Acme", List.of(GREENHOUSE_LISTING, CAREERS_LISTING))).toList();

        assertThat(urls).containsExactly("https://boards.greenhouse.io/acme/jobs/101");
        verify(pageLoader, never()).load(CAREERS_LISTING);
    }

    @Test
    void unrenderableListingsFailTheCollection() {
        when(pageLoader.load(anyString())).thenThrow(new RenderException(GREENHOUSE_LISTING, "timeout", true));

        Stream<String> urls = collector.collect(new EmployerTarget("Acme", List.of(GREENHOUSE_LISTING)));

        assertThatThrownBy(urls::toList)
            .isInstanceOf(CollectionException.class)
            .hasMessageContaining("listing_render_failed");
    }

    @Test
    void listingWithoutJobLinksFailsTheCollection() {
        when(pageLoader.load(CAREERS_LISTING)).thenReturn(page(CAREERS_LISTING, "<html><body><a href=\"/about\">About</a></body></html>"));

        Stream<String> urls = collector.collect(new EmployerTarget("Acme", List.of(CAREERS_LISTING)));

        assertThatThrownBy(urls::toList)
            .isInstanceOf(CollectionException.class)
            .hasMessageContaining("no_job_links");
    }

    private RenderedPage page(String url, String html) {
        return new RenderedPage(url, url, html);
    }
}
