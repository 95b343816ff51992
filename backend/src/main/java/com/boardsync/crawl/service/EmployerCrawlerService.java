package com.boardsync.crawl.service;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.jobs.CollectionException;
import com.boardsync.crawl.jobs.ExtractionMetrics;
import com.boardsync.crawl.jobs.JobExtractionService;
import com.boardsync.crawl.jobs.JobUrlCollector;
import com.boardsync.crawl.model.CrawlAction;
import com.boardsync.crawl.model.EmployerCrawlSummary;
import com.boardsync.crawl.model.EmployerTarget;
import com.boardsync.crawl.model.ExtractionOutcome;
import com.boardsync.crawl.model.FreshnessDecision;
import com.boardsync.crawl.model.MergeResult;
import com.boardsync.crawl.persistence.StoreConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

/**
 * Full crawl of one employer: collects its job URLs, extracts them on the bounded extraction pool and runs every
 * candidate through the dedup engine. Forwarded records go to the run's submission session.
 */
@Service
public class EmployerCrawlerService {
    private static final Logger log = LoggerFactory.getLogger(EmployerCrawlerService.class);

    private final JobUrlCollector urlCollector;
    private final JobExtractionService extractionService;
    private final JobMergeService mergeService;
    private final ExecutorService extractionExecutor;
    private final int window;

    public EmployerCrawlerService(
        JobUrlCollector urlCollector,
        JobExtractionService extractionService,
        JobMergeService mergeService,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor,
        CrawlerProperties properties
    ) {
        this.urlCollector = urlCollector;
        this.extractionService = extractionService;
        this.mergeService = mergeService;
        this.extractionExecutor = extractionExecutor;
        this.window = Math.max(1, properties.getGlobalConcurrency() * 2);
    }

    public EmployerCrawlSummary crawlEmployer(
        EmployerTarget employer,
        FreshnessDecision decision,
        ExtractionMetrics metrics,
        BatchSubmitter.Session session,
        CrawlCancellation cancellation
    ) {
        log.info("Crawling {} ({})", employer.name(), decision.reason());
        Counts counts = new Counts();
        Deque<Pending> inFlight = new ArrayDeque<>();
        boolean employerFailed = false;
        boolean aborted = false;

        try {
            try (Stream<String> urls = urlCollector.collect(employer)) {
                Iterator<String> iterator = urls.iterator();
                while (iterator.hasNext()) {
                    if (cancellation.isCancelled()) {
                        aborted = true;
                        break;
                    }
                    String url = iterator.next();
                    counts.collected++;
                    inFlight.add(new Pending(url, CompletableFuture.supplyAsync(
                        () -> extractionService.extract(url, employer.name(), metrics),
                        extractionExecutor
                    )));
                    while (inFlight.size() >= window) {
                        complete(inFlight.poll(), counts, session);
                    }
                }
            } catch (CollectionException e) {
                employerFailed = true;
                increment(counts.errors, "collection_failed");
                log.warn("URL collection failed for {}: {}", e.getEmployerName(), e.getMessage());
            }

            while (!inFlight.isEmpty()) {
                Pending pending = inFlight.poll();
                if (cancellation.isCancelled() && !pending.future.isDone()) {
                    aborted = true;
                    pending.future.cancel(false);
                    increment(counts.errors, "cancelled");
                    continue;
                }
                complete(pending, counts, session);
            }
        } catch (DataAccessException e) {
            cancelAll(inFlight);
            throw e;
        } catch (RejectedExecutionException e) {
            // extraction pool already shut down: the process is stopping
            cancelAll(inFlight);
            aborted = true;
            increment(counts.errors, "extraction_rejected");
            log.warn("Extraction pool refused work for {}; treating as aborted", employer.name());
        } catch (RuntimeException e) {
            cancelAll(inFlight);
            if (cancellation.isCancelled()) {
                aborted = true;
            } else {
                employerFailed = true;
            }
            increment(counts.errors, "employer_crawl_exception");
            log.warn("Employer crawl failed for {}", employer.name(), e);
        }

        if (aborted) {
            log.info("Crawl of {} aborted after {} URLs: {}", employer.name(), counts.collected, cancellation.reason());
        }
        log.info(
            "Employer {}: collected={}, inserted={}, updated={}, skipped={}, rejected={}, failed={}",
            employer.name(),
            counts.collected,
            counts.inserted,
            counts.updated,
            counts.skipped,
            counts.rejected,
            counts.failed
        );
        return new EmployerCrawlSummary(
            employer.name(),
            CrawlAction.FULL_CRAWL,
            decision.reason(),
            counts.collected,
            counts.inserted,
            counts.updated,
            counts.skipped,
            counts.rejected,
            counts.failed,
            employerFailed,
            aborted,
            topErrors(counts.errors, 5)
        );
    }

    private void complete(Pending pending, Counts counts, BatchSubmitter.Session session) {
        ExtractionOutcome outcome;
        try {
            outcome = pending.future.join();
        } catch (CancellationException e) {
            increment(counts.errors, "cancelled");
            return;
        } catch (CompletionException e) {
            counts.failed++;
            increment(counts.errors, "extraction_exception");
            log.warn("Extraction of {} failed", pending.url, e.getCause());
            return;
        }

        switch (outcome.status()) {
            case REJECTED -> {
                counts.rejected++;
                increment(counts.errors, outcome.reason());
            }
            case FAILED -> {
                counts.failed++;
                increment(counts.errors, outcome.reason());
            }
            case EXTRACTED -> merge(outcome, counts, session);
        }
    }

    private void merge(ExtractionOutcome outcome, Counts counts, BatchSubmitter.Session session) {
        MergeResult result;
        try {
            result = mergeService.merge(outcome.candidate());
        } catch (StoreConstraintViolationException e) {
            log.error("Store rejected {} even after falling back to update", e.getSourceUrl(), e);
            counts.failed++;
            increment(counts.errors, "store_constraint_violation");
            return;
        }
        switch (result.outcome()) {
            case INSERT -> counts.inserted++;
            case UPDATE -> counts.updated++;
            case SKIP -> counts.skipped++;
        }
        if (result.forwarded()) {
            session.add(result.record());
        }
    }

    private void cancelAll(Deque<Pending> inFlight) {
        while (!inFlight.isEmpty()) {
            inFlight.poll().future.cancel(false);
        }
    }

    private void increment(Map<String, Integer> errors, String key) {
        errors.put(key, errors.getOrDefault(key, 0) + 1);
    }

    private Map<String, Integer> topErrors(Map<String, Integer> errors, int limit) {
        return errors.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
            .limit(limit)
            .collect(
                LinkedHashMap::new,
                (map, entry) -> map.put(entry.getKey(), entry.getValue()),
                LinkedHashMap::putAll
            );
    }

    private record Pending(String url, CompletableFuture<ExtractionOutcome> future) {
    }

    private static final class Counts {
        private final Map<String, Integer> errors = new LinkedHashMap<>();
        private int collected;
        private int inserted;
        private int updated;
        private int skipped;
        private int rejected;
        private int failed;
    }
}
