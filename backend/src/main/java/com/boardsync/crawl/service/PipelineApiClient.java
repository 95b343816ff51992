package com.boardsync.crawl.service;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.http.PoliteHttpClient;
import com.boardsync.crawl.model.HttpFetchResult;
import com.boardsync.crawl.model.PipelineBatchResponse;
import com.boardsync.crawl.model.PipelineJobPayload;
import com.boardsync.crawl.model.PipelineSubmitRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Client for the downstream ingestion API. Each call is a single HTTP attempt; retry policy belongs to the caller.
 */
@Component
public class PipelineApiClient {
    static final String BATCH_PATH = "/api/batch/jobs";
    static final String WEBHOOK_PATH = "/api/webhook/jobs";
    static final String HEALTH_PATH = "/api/health";

    private final CrawlerProperties properties;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public PipelineApiClient(CrawlerProperties properties, PoliteHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        CrawlerProperties.Submission submission = properties.getSubmission();
        return submission.isEnabled() && submission.getBaseUrl() != null && !submission.getBaseUrl().isBlank();
    }

    /**
     * @throws SubmissionTransportException on I/O errors, timeouts, 408, 429, 5xx or an unparseable body
     * @throws SubmissionRejectedException on any other non-2xx status
     */
    public PipelineBatchResponse submitBatch(List<PipelineJobPayload> jobs) {
        return post(BATCH_PATH, jobs);
    }

    public PipelineBatchResponse submitSingle(PipelineJobPayload job) {
        return post(WEBHOOK_PATH, List.of(job));
    }

    public boolean isHealthy() {
        if (!isConfigured()) {
            return false;
        }
        HttpFetchResult result = httpClient.get(
            url(HEALTH_PATH),
            "application/json",
            headers(),
            timeout(),
            1
        );
        return result != null && result.isSuccessful();
    }

    private PipelineBatchResponse post(String path, List<PipelineJobPayload> jobs) {
        String body;
        try {
            body = objectMapper.writeValueAsString(new PipelineSubmitRequest(jobs, properties.getSubmission().getSource()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize submission payload", e);
        }
        HttpFetchResult result = httpClient.postJson(url(path), body, headers(), timeout(), 1);
        if (result == null) {
            throw new SubmissionTransportException("no_response");
        }
        if (result.isTransportFailure()) {
            String detail = result.errorCode() != null ? result.errorCode() : "http_" + result.statusCode();
            throw new SubmissionTransportException(detail);
        }
        if (!result.isSuccessful()) {
            throw new SubmissionRejectedException(result.statusCode(), "http_" + result.statusCode() + ": " + abbreviate(result.body()));
        }
        return parse(result.body(), jobs.size());
    }

    private PipelineBatchResponse parse(String body, int size) {
        if (body == null || body.isBlank()) {
            throw new SubmissionTransportException("empty_response_body");
        }
        PipelineBatchResponse response;
        try {
            response = objectMapper.readValue(body, PipelineBatchResponse.class);
        } catch (JsonProcessingException e) {
            throw new SubmissionTransportException("malformed_response_body", e);
        }
        if (response == null) {
            throw new SubmissionTransportException("malformed_response_body");
        }
        if (response.created() == null && response.skipped() == null && response.rejected() == null) {
            return new PipelineBatchResponse(size, 0, List.of());
        }
        return response;
    }

    private String url(String path) {
        String base = properties.getSubmission().getBaseUrl().trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private Map<String, String> headers() {
        String apiKey = properties.getSubmission().getApiKey();
        return apiKey == null || apiKey.isBlank() ? Map.of() : Map.of("X-API-Key", apiKey);
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.getSubmission().getTimeoutSeconds());
    }

    private String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 300 ? body : body.substring(0, 300);
    }
}
