package com.boardsync.crawl.persistence;

import com.boardsync.crawl.model.CrawlRunMeta;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CrawlRunRepositoryTest {

    @Autowired
    private CrawlRunRepository repository;

    @Test
    void staleRunningRowsAreNotActive() {
        Instant now = Instant.now();
        long fresh = repository.insertCrawlRun(now, "RUNNING", "fresh");
        long stale = repository.insertCrawlRun(now.minus(Duration.ofHours(2)), "RUNNING", "stale");

        List<CrawlRunMeta> active = repository.findActiveCrawlRuns(now.minus(Duration.ofMinutes(5)));

        assertThat(active).extracting(CrawlRunMeta::crawlRunId).contains(fresh).doesNotContain(stale);
        assertThat(repository.findRunningCrawlRuns()).extracting(CrawlRunMeta::crawlRunId).contains(fresh, stale);
    }

    @Test
    void completedRunIsNoLongerActive() {
        Instant now = Instant.now();
        long runId = repository.insertCrawlRun(now, "RUNNING", "test");

        repository.completeCrawlRun(runId, now.plusSeconds(5), "COMPLETED", "done");

        CrawlRunMeta meta = repository.findCrawlRunById(runId);
        assertEquals("COMPLETED", meta.status());
        assertThat(meta.finishedAt()).isNotNull();
        assertThat(repository.findActiveCrawlRuns(now.minus(Duration.ofMinutes(5))))
            .extracting(CrawlRunMeta::crawlRunId)
            .doesNotContain(runId);
    }

    @Test
    void failedSubmissionKeepsEveryUrlOfTheBatch() {
        long runId = repository.insertCrawlRun(Instant.now(), "RUNNING", "test");

        repository.insertFailedSubmission(
            runId,
            Instant.now(),
            3,
            List.of("https://jobs.lever.co/a/1", "https://jobs.lever.co/a/2"),
            "http_503"
        );

        assertThat(repository.findFailedSubmissionUrls(runId))
            .containsExactly("https://jobs.lever.co/a/1", "https://jobs.lever.co/a/2");
        assertThat(repository.tableCounts()).containsKey("failed_submissions");
    }
}
