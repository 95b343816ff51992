package com.boardsync.crawl.service;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.model.BatchSubmissionResult;
import com.boardsync.crawl.model.JobRecord;
import com.boardsync.crawl.model.PipelineBatchResponse;
import com.boardsync.crawl.model.PipelineJobPayload;
import com.boardsync.crawl.model.RejectedJob;
import com.boardsync.crawl.persistence.CrawlRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Delivers forwarded records downstream in batches. Transport failures are retried with exponential backoff and,
 * once exhausted, recorded in the failed-submission ledger. Downstream rejections are logged and never retried.
 */
@Service
public class BatchSubmitter {
    private static final Logger log = LoggerFactory.getLogger(BatchSubmitter.class);

    private final CrawlerProperties properties;
    private final PipelineApiClient pipelineApiClient;
    private final CrawlRunRepository crawlRunRepository;

    public BatchSubmitter(
        CrawlerProperties properties,
        PipelineApiClient pipelineApiClient,
        CrawlRunRepository crawlRunRepository
    ) {
        this.properties = properties;
        this.pipelineApiClient = pipelineApiClient;
        this.crawlRunRepository = crawlRunRepository;
    }

    public Session openSession(Long crawlRunId) {
        return new Session(crawlRunId, properties.getSubmission().getBatchSize(), pipelineApiClient.isConfigured());
    }

    BatchSubmissionResult submit(List<JobRecord> batch, Long crawlRunId) {
        String source = properties.getSubmission().getSource();
        List<PipelineJobPayload> payload = batch.stream()
            .map(record -> PipelineJobPayload.from(record, source))
            .toList();
        List<String> urls = batch.stream().map(JobRecord::sourceUrl).toList();
        int maxAttempts = properties.getSubmission().getMaxAttempts();
        String lastError = null;
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                PipelineBatchResponse response = payload.size() == 1
                    ? pipelineApiClient.submitSingle(payload.get(0))
                    : pipelineApiClient.submitBatch(payload);
                BatchSubmissionResult result = BatchSubmissionResult.delivered(batch.size(), attempt, response);
                for (RejectedJob rejected : result.rejected()) {
                    log.warn("Downstream rejected {}: {}", rejected.url(), rejected.reason());
                }
                return result;
            } catch (SubmissionRejectedException e) {
                log.warn("Downstream refused batch of {} with HTTP {} ({}); not retrying", batch.size(), e.getStatusCode(), e.getMessage());
                List<RejectedJob> rejected = urls.stream().map(url -> new RejectedJob(url, e.getMessage())).toList();
                return BatchSubmissionResult.rejectedAll(batch.size(), attempt, rejected, e.getMessage());
            } catch (SubmissionTransportException e) {
                lastError = e.getMessage();
                log.warn("Batch of {} failed to submit on attempt {}/{}: {}", batch.size(), attempt, maxAttempts, lastError);
                if (attempt < maxAttempts && !sleepBackoff(attempt)) {
                    lastError = lastError + "; interrupted";
                    break;
                }
            }
        }
        log.error("Batch of {} could not be delivered after {} attempts: {}", batch.size(), attempt, lastError);
        crawlRunRepository.insertFailedSubmission(crawlRunId, Instant.now(), attempt, urls, lastError);
        return BatchSubmissionResult.failed(batch.size(), attempt, lastError);
    }

    private boolean sleepBackoff(int attempt) {
        long delay = (long) properties.getSubmission().getRetryBaseDelayMs() * (1L << Math.max(0, attempt - 1));
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Per-run accumulator. Flushes automatically when the batch size is reached; callers flush at employer and run
     * boundaries.
     */
    public final class Session {
        private final Long crawlRunId;
        private final int batchSize;
        private final boolean enabled;
        private final List<JobRecord> buffer = new ArrayList<>();
        private final Set<String> forwardedUrls = new LinkedHashSet<>();
        private int delivered;
        private int downstreamRejected;
        private int failedBatches;
        private int undelivered;

        private Session(Long crawlRunId, int batchSize, boolean enabled) {
            this.crawlRunId = crawlRunId;
            this.batchSize = batchSize;
            this.enabled = enabled;
        }

        public synchronized void add(JobRecord record) {
            forwardedUrls.add(record.sourceUrl());
            if (!enabled) {
                undelivered++;
                return;
            }
            buffer.add(record);
            if (buffer.size() >= batchSize) {
                flush();
            }
        }

        public synchronized BatchSubmissionResult flush() {
            if (buffer.isEmpty()) {
                return null;
            }
            List<JobRecord> batch = List.copyOf(buffer);
            buffer.clear();
            BatchSubmissionResult result = submit(batch, crawlRunId);
            if (result.failed()) {
                failedBatches++;
                undelivered += result.size();
            } else {
                delivered += result.created() + result.skipped();
                downstreamRejected += result.rejected().size();
            }
            return result;
        }

        public synchronized int pending() {
            return buffer.size();
        }

        public synchronized int delivered() {
            return delivered;
        }

        public synchronized int downstreamRejected() {
            return downstreamRejected;
        }

        public synchronized int failedBatches() {
            return failedBatches;
        }

        public synchronized int undelivered() {
            return undelivered;
        }

        public synchronized Set<String> forwardedUrls() {
            return Set.copyOf(forwardedUrls);
        }
    }
}
