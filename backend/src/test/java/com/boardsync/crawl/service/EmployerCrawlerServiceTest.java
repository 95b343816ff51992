package com.boardsync.crawl.service;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.jobs.CollectionException;
import com.boardsync.crawl.jobs.ExtractionMetrics;
import com.boardsync.crawl.jobs.JobExtractionService;
import com.boardsync.crawl.jobs.JobUrlCollector;
import com.boardsync.crawl.model.AtsType;
import com.boardsync.crawl.model.EmployerCrawlState;
import com.boardsync.crawl.model.EmployerCrawlSummary;
import com.boardsync.crawl.model.EmployerTarget;
import com.boardsync.crawl.model.ExtractionOutcome;
import com.boardsync.crawl.model.FreshnessDecision;
import com.boardsync.crawl.model.JobRecord;
import com.boardsync.crawl.model.MergeOutcome;
import com.boardsync.crawl.model.MergeResult;
import com.boardsync.crawl.persistence.CrawlRunRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmployerCrawlerServiceTest {
    private static final EmployerTarget ACME = new EmployerTarget("Acme", List.of("https://boards.greenhouse.io/acme"));

    @Mock
    private JobUrlCollector urlCollector;
    @Mock
    private JobExtractionService extractionService;
    @Mock
    private JobMergeService mergeService;
    @Mock
    private PipelineApiClient pipelineApiClient;
    @Mock
    private CrawlRunRepository crawlRunRepository;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private EmployerCrawlerService service;
    private BatchSubmitter.Session session;
    private ExtractionMetrics metrics;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setGlobalConcurrency(2);
        service = new EmployerCrawlerService(urlCollector, extractionService, mergeService, executor, properties);
        session = new BatchSubmitter(properties, pipelineApiClient, crawlRunRepository).openSession(1L);
        metrics = new ExtractionMetrics(0.0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void countsEveryOutcomeAndForwardsOnlyWrittenRecords() {
        String inserted = "https://boards.greenhouse.io/acme/jobs/1";
        String unchanged = "https://boards.greenhouse.io/acme/jobs/2";
        String london = "https://boards.greenhouse.io/acme/jobs/3";
        String broken = "https://boards.greenhouse.io/acme/jobs/4";
        JobRecord first = candidate(inserted);
        JobRecord second = candidate(unchanged);
        when(urlCollector.collect(ACME)).thenReturn(Stream.of(inserted, unchanged, london, broken));
        when(extractionService.extract(eq(inserted), eq("Acme"), any())).thenReturn(ExtractionOutcome.extracted(first));
        when(extractionService.extract(eq(unchanged), eq("Acme"), any())).thenReturn(ExtractionOutcome.extracted(second));
        when(extractionService.extract(eq(london), eq("Acme"), any())).thenReturn(ExtractionOutcome.rejected("non_us_location"));
        when(extractionService.extract(eq(broken), eq("Acme"), any())).thenReturn(ExtractionOutcome.failed("render_failed"));
        when(mergeService.merge(first)).thenReturn(new MergeResult(MergeOutcome.INSERT, first.withId(1L), "new_url"));
        when(mergeService.merge(second)).thenReturn(new MergeResult(MergeOutcome.SKIP, second.withId(2L), "already_complete"));

        EmployerCrawlSummary summary = service.crawlEmployer(ACME, decision(), metrics, session, new CrawlCancellation());

        assertThat(summary.urlsCollected()).isEqualTo(4);
        assertThat(summary.inserted()).isEqualTo(1);
        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(summary.rejected()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.employerFailed()).isFalse();
        assertThat(summary.topErrors()).containsEntry("non_us_location", 1).containsEntry("render_failed", 1);
        assertThat(session.forwardedUrls()).containsExactly(inserted);
    }

    @Test
    void collectionFailureMarksEmployerFailed() {
        when(urlCollector.collect(ACME)).thenThrow(new CollectionException("Acme", "No job URLs collected for Acme: no_job_links"));

        EmployerCrawlSummary summary = service.crawlEmployer(ACME, decision(), metrics, session, new CrawlCancellation());

        assertThat(summary.employerFailed()).isTrue();
        assertThat(summary.topErrors()).containsEntry("collection_failed", 1);
        verify(extractionService, never()).extract(any(), any(), any());
    }

    @Test
    void cancelledRunStopsSchedulingAndReportsAbort() {
        CrawlCancellation cancellation = new CrawlCancellation();
        cancellation.cancel("stop_requested");
        when(urlCollector.collect(ACME)).thenReturn(Stream.of("https://boards.greenhouse.io/acme/jobs/1"));

        EmployerCrawlSummary summary = service.crawlEmployer(ACME, decision(), metrics, session, cancellation);

        assertThat(summary.aborted()).isTrue();
        assertThat(summary.urlsCollected()).isZero();
        verify(extractionService, never()).extract(any(), any(), any());
    }

    @Test
    void shutDownExtractionPoolAbortsTheEmployer() {
        executor.shutdown();
        when(urlCollector.collect(ACME)).thenReturn(Stream.of("https://boards.greenhouse.io/acme/jobs/1"));

        EmployerCrawlSummary summary = service.crawlEmployer(ACME, decision(), metrics, session, new CrawlCancellation());

        assertThat(summary.aborted()).isTrue();
        assertThat(summary.employerFailed()).isFalse();
        assertThat(summary.topErrors()).containsKey("extraction_rejected");
        verify(extractionService, never()).extract(any(), any(), any());
    }

    @Test
    void unexpectedFailureKeepsCountsOfRecordsAlreadyWritten() {
        String written = "https://boards.greenhouse.io/acme/jobs/1";
        String broken = "https://boards.greenhouse.io/acme/jobs/2";
        JobRecord first = candidate(written);
        JobRecord second = candidate(broken);
        when(urlCollector.collect(ACME)).thenReturn(Stream.of(written, broken));
        when(extractionService.extract(eq(written), eq("Acme"), any())).thenReturn(ExtractionOutcome.extracted(first));
        when(extractionService.extract(eq(broken), eq("Acme"), any())).thenReturn(ExtractionOutcome.extracted(second));
        when(mergeService.merge(first)).thenReturn(new MergeResult(MergeOutcome.INSERT, first.withId(1L), "new_url"));
        when(mergeService.merge(second)).thenThrow(new IllegalStateException("unexpected record state"));

        EmployerCrawlSummary summary = service.crawlEmployer(ACME, decision(), metrics, session, new CrawlCancellation());

        assertThat(summary.employerFailed()).isTrue();
        assertThat(summary.aborted()).isFalse();
        assertThat(summary.urlsCollected()).isEqualTo(2);
        assertThat(summary.inserted()).isEqualTo(1);
        assertThat(summary.topErrors()).containsEntry("employer_crawl_exception", 1);
        assertThat(session.forwardedUrls()).containsExactly(written);
    }

    private FreshnessDecision decision() {
        return FreshnessDecision.fullCrawl(EmployerCrawlState.empty("Acme"), "no known jobs, first visit");
    }

    private JobRecord candidate(String url) {
        return new JobRecord(null, "Acme", url, "Engineer", "Acme", null, "Austin, TX", null, "Full time",
            "Build things.", null, null, null, null, null, Instant.now(), AtsType.GREENHOUSE);
    }
}
