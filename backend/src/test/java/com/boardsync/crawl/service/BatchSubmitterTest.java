package com.boardsync.crawl.service;

import com.boardsync.config.CrawlConfig;
import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.http.PoliteHttpClient;
import com.boardsync.crawl.model.AtsType;
import com.boardsync.crawl.model.BatchSubmissionResult;
import com.boardsync.crawl.model.JobRecord;
import com.boardsync.crawl.persistence.CrawlRunRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class BatchSubmitterTest {
    private MockWebServer server;
    private ExecutorService executor;
    private CrawlRunRepository crawlRunRepository;
    private BatchSubmitter submitter;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        CrawlerProperties.Submission submission = properties.getSubmission();
        submission.setEnabled(true);
        submission.setBaseUrl(server.url("/").toString());
        submission.setApiKey("test-key");
        submission.setBatchSize(5);
        submission.setMaxAttempts(3);
        submission.setRetryBaseDelayMs(1);

        executor = Executors.newFixedThreadPool(2);
        ObjectMapper objectMapper = new CrawlConfig().objectMapper();
        PipelineApiClient client = new PipelineApiClient(properties, new PoliteHttpClient(properties, executor), objectMapper);
        crawlRunRepository = Mockito.mock(CrawlRunRepository.class);
        submitter = new BatchSubmitter(properties, client, crawlRunRepository);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void partialDownstreamRejectionIsCountedWithoutRetry() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"created":3,"skipped":0,"rejected":[
                  {"url":"https://jobs.lever.co/acme/4","reason":"missing salary"},
                  {"url":"https://jobs.lever.co/acme/5","reason":"duplicate"}
                ]}
                """));

        BatchSubmitter.Session session = submitter.openSession(11L);
        for (int i = 1; i <= 5; i++) {
            session.add(record(i));
        }

        assertThat(session.pending()).isZero();
        assertThat(session.delivered()).isEqualTo(3);
        assertThat(session.downstreamRejected()).isEqualTo(2);
        assertThat(session.failedBatches()).isZero();
        assertThat(server.getRequestCount()).isEqualTo(1);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo(PipelineApiClient.BATCH_PATH);
        assertThat(request.getHeader("X-API-Key")).isEqualTo("test-key");
        assertThat(request.getBody().readUtf8()).contains("\"sourceUrl\":\"https://jobs.lever.co/acme/1\"");
    }

    @Test
    void transportFailuresAreRetriedThenRecordedAsFailedBatch() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        server.enqueue(new MockResponse().setResponseCode(502).setBody("bad gateway"));
        server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

        BatchSubmissionResult result = submitter.submit(List.of(record(1), record(2)), 21L);

        assertThat(result.failed()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.error()).isEqualTo("http_503");
        assertThat(server.getRequestCount()).isEqualTo(3);
        verify(crawlRunRepository).insertFailedSubmission(
            eq(21L),
            any(Instant.class),
            eq(3),
            eq(List.of("https://jobs.lever.co/acme/1", "https://jobs.lever.co/acme/2")),
            eq("http_503")
        );
    }

    @Test
    void recoversWhenARetrySucceeds() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));
        server.enqueue(new MockResponse()
            .setResponseCode(201)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"created\":1,\"skipped\":1}"));

        BatchSubmissionResult result = submitter.submit(List.of(record(1), record(2)), 22L);

        assertThat(result.failed()).isFalse();
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.created() + result.skipped()).isEqualTo(2);
        verify(crawlRunRepository, never()).insertFailedSubmission(any(), any(), anyInt(), anyList(), anyString());
    }

    @Test
    void clientErrorRejectsWholeBatchWithoutRetry() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":\"invalid payload\"}"));

        BatchSubmissionResult result = submitter.submit(List.of(record(1), record(2)), 23L);

        assertThat(result.failed()).isFalse();
        assertThat(result.rejected()).hasSize(2);
        assertThat(server.getRequestCount()).isEqualTo(1);
        verify(crawlRunRepository, never()).insertFailedSubmission(any(), any(), anyInt(), anyList(), anyString());
    }

    @Test
    void singleRecordGoesToWebhookEndpoint() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"status\":\"ok\"}"));

        BatchSubmitter.Session session = submitter.openSession(24L);
        session.add(record(1));
        session.flush();

        assertThat(session.delivered()).isEqualTo(1);
        assertThat(session.forwardedUrls()).containsExactly("https://jobs.lever.co/acme/1");
        assertThat(server.takeRequest().getPath()).isEqualTo(PipelineApiClient.WEBHOOK_PATH);
    }

    private JobRecord record(int index) {
        return new JobRecord(
            (long) index,
            "Acme",
            "https://jobs.lever.co/acme/" + index,
            "Engineer " + index,
            "Acme",
            null,
            "New York, NY",
            null,
            "Full time",
            "Build things.",
            null,
            null,
            null,
            null,
            null,
            Instant.now(),
            AtsType.LEVER
        );
    }
}
