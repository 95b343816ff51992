package com.boardsync.crawl.service;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.jobs.ExtractionMetrics;
import com.boardsync.crawl.model.CrawlAction;
import com.boardsync.crawl.model.CrawlProgressView;
import com.boardsync.crawl.model.CrawlRunMeta;
import com.boardsync.crawl.model.CrawlRunOptions;
import com.boardsync.crawl.model.CrawlRunSummary;
import com.boardsync.crawl.model.EmployerCrawlSummary;
import com.boardsync.crawl.model.EmployerTarget;
import com.boardsync.crawl.model.ExtractionMetricsSnapshot;
import com.boardsync.crawl.model.FreshnessDecision;
import com.boardsync.crawl.model.RunPhase;
import com.boardsync.crawl.model.RunProgress;
import com.boardsync.crawl.model.RunTotals;
import com.boardsync.crawl.persistence.CrawlRunRepository;
import com.boardsync.crawl.progress.CheckpointException;
import com.boardsync.crawl.progress.RunProgressStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one invocation through the employer loop:
 * SELECTING_EMPLOYER, CRAWLING_EMPLOYER, SUBMITTING, CHECKPOINTING, then back to SELECTING_EMPLOYER or DONE.
 * A stop request moves the run to INTERRUPTED at the next employer boundary. The resume pointer only advances past
 * an employer once its forwarded records were flushed and the checkpoint was written.
 */
@Service
public class CrawlOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(CrawlOrchestratorService.class);
    private static final long HEARTBEAT_SECONDS = 30;
    private static final Duration STALE_RUN_AFTER = Duration.ofMinutes(5);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);

    private final CrawlRunRepository crawlRunRepository;
    private final EmployerDirectory employerDirectory;
    private final FreshnessEvaluator freshnessEvaluator;
    private final EmployerCrawlerService employerCrawlerService;
    private final BatchSubmitter batchSubmitter;
    private final RunProgressStore progressStore;
    private final ExecutorService crawlRunExecutor;
    private final CrawlerProperties properties;
    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();

    public CrawlOrchestratorService(
        CrawlRunRepository crawlRunRepository,
        EmployerDirectory employerDirectory,
        FreshnessEvaluator freshnessEvaluator,
        EmployerCrawlerService employerCrawlerService,
        BatchSubmitter batchSubmitter,
        RunProgressStore progressStore,
        @Qualifier("crawlRunExecutor") ExecutorService crawlRunExecutor,
        CrawlerProperties properties
    ) {
        this.crawlRunRepository = crawlRunRepository;
        this.employerDirectory = employerDirectory;
        this.freshnessEvaluator = freshnessEvaluator;
        this.employerCrawlerService = employerCrawlerService;
        this.batchSubmitter = batchSubmitter;
        this.progressStore = progressStore;
        this.crawlRunExecutor = crawlRunExecutor;
        this.properties = properties;
    }

    public CrawlRunSummary run(CrawlRunOptions options) {
        ActiveRun run = begin();
        return runWithId(run, options == null ? CrawlRunOptions.defaults() : options);
    }

    public long startAsync(CrawlRunOptions options) {
        ActiveRun run = begin();
        CrawlRunOptions safeOptions = options == null ? CrawlRunOptions.defaults() : options;
        crawlRunExecutor.submit(() -> runWithId(run, safeOptions));
        return run.crawlRunId;
    }

    /**
     * Requests cancellation of the active run. The run stops at the next employer boundary.
     *
     * @return false when no run is active
     */
    public boolean stop(String reason) {
        ActiveRun run = activeRun.get();
        if (run == null) {
            return false;
        }
        log.info("Stop requested for crawl run {}: {}", run.crawlRunId, reason);
        run.cancellation.cancel(reason);
        return true;
    }

    /**
     * Runs on context close, before the executors and the datasource this service depends on are destroyed.
     * Cancels the active run and waits until it has checkpointed at an employer boundary.
     */
    @PreDestroy
    public void stopOnShutdown() {
        if (!stop("shutdown")) {
            return;
        }
        try {
            if (!awaitCompletion(SHUTDOWN_GRACE)) {
                log.warn("Crawl run did not reach an employer boundary within {}", SHUTDOWN_GRACE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean awaitCompletion(Duration timeout) throws InterruptedException {
        ActiveRun run = activeRun.get();
        if (run == null) {
            return true;
        }
        return run.finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public CrawlProgressView progress() {
        ActiveRun run = activeRun.get();
        if (run != null) {
            return new CrawlProgressView(run.phase, run.crawlRunId, run.currentEmployer, run.progress);
        }
        RunProgress stored;
        try {
            stored = progressStore.load().orElse(null);
        } catch (CheckpointException e) {
            log.warn("Progress file unreadable: {}", e.getMessage());
            stored = null;
        }
        return new CrawlProgressView(RunPhase.IDLE, null, null, stored);
    }

    private ActiveRun begin() {
        List<CrawlRunMeta> otherRuns = crawlRunRepository.findActiveCrawlRuns(Instant.now().minus(STALE_RUN_AFTER));
        if (!otherRuns.isEmpty() && activeRun.get() == null) {
            CrawlRunMeta other = otherRuns.get(0);
            throw new ActiveCrawlRunException("Active crawl run in progress (id=" + other.crawlRunId()
                + ", startedAt=" + other.startedAt() + ")");
        }
        ActiveRun candidate = new ActiveRun();
        if (!activeRun.compareAndSet(null, candidate)) {
            ActiveRun current = activeRun.get();
            throw new ActiveCrawlRunException("Active crawl run in progress (id="
                + (current == null ? "unknown" : current.crawlRunId) + ")");
        }
        try {
            candidate.startedAt = Instant.now();
            candidate.crawlRunId = crawlRunRepository.insertCrawlRun(candidate.startedAt, "RUNNING", "crawl started");
        } catch (RuntimeException e) {
            activeRun.set(null);
            candidate.finished.countDown();
            throw e;
        }
        return candidate;
    }

    private CrawlRunSummary runWithId(ActiveRun run, CrawlRunOptions options) {
        long crawlRunId = run.crawlRunId;
        String status = "FAILED";
        String notes = "crawl_failed";
        List<EmployerCrawlSummary> summaries = new ArrayList<>();
        ExtractionMetrics metrics = new ExtractionMetrics(properties.getAi().getCostPerThousandTokens());
        BatchSubmitter.Session session = batchSubmitter.openSession(crawlRunId);
        Instant finishedAt;

        ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor();
        heartbeat.scheduleAtFixedRate(
            () -> {
                try {
                    crawlRunRepository.updateCrawlRunHeartbeat(crawlRunId, Instant.now());
                } catch (RuntimeException e) {
                    log.debug("Heartbeat update failed for crawl run {}: {}", crawlRunId, e.getMessage());
                }
            },
            HEARTBEAT_SECONDS,
            HEARTBEAT_SECONDS,
            TimeUnit.SECONDS
        );

        try {
            int employerBatchSize = options.employerBatchSize() == null
                ? properties.getRun().getEmployerBatchSize()
                : Math.max(1, options.employerBatchSize());
            boolean resume = options.resume() == null ? properties.getRun().isResume() : options.resume();

            List<EmployerTarget> employers = employerDirectory.employers();
            RunProgress progress = initialProgress(employers, employerBatchSize, resume);
            progressStore.save(progress);
            run.progress = progress;

            int processed = 0;
            boolean interrupted = false;
            while (true) {
                if (run.cancellation.isCancelled()) {
                    interrupted = true;
                    break;
                }
                run.phase = RunPhase.SELECTING_EMPLOYER;
                if (processed >= employerBatchSize || progress.isCycleComplete()) {
                    break;
                }
                int index = progress.nextIndex();
                EmployerTarget employer = employers.get(index);
                run.currentEmployer = employer.name();

                run.phase = RunPhase.CRAWLING_EMPLOYER;
                EmployerCrawlSummary summary = crawlEmployer(employer, metrics, session, run.cancellation);
                summaries.add(summary);

                run.phase = RunPhase.SUBMITTING;
                session.flush();

                if (summary.aborted()) {
                    interrupted = true;
                    break;
                }

                run.phase = RunPhase.CHECKPOINTING;
                progress = progress.withCompleted(index, Instant.now());
                progressStore.save(progress);
                run.progress = progress;
                processed++;
                crawlRunRepository.updateCrawlRunProgress(crawlRunId, totals(summaries, session), Instant.now());
            }

            if (interrupted) {
                run.phase = RunPhase.INTERRUPTED;
                progress = progress.touch(Instant.now());
                progressStore.save(progress);
                run.progress = progress;
                status = "ABORTED";
                notes = "interrupted: " + run.cancellation.reason();
            } else {
                run.phase = RunPhase.DONE;
                boolean hadErrors = session.failedBatches() > 0
                    || summaries.stream().anyMatch(EmployerCrawlSummary::employerFailed);
                status = hadErrors ? "COMPLETED_WITH_ERRORS" : "COMPLETED";
                notes = "employers=" + summaries.size() + ", next_index=" + progress.nextIndex() + "/" + employers.size();
            }
        } catch (CheckpointException e) {
            log.error("Crawl run {} failed to checkpoint progress", crawlRunId, e);
            run.phase = RunPhase.INTERRUPTED;
            status = "FAILED";
            notes = "checkpoint_failed: " + e.getMessage();
        } catch (Exception e) {
            log.error("Crawl run {} failed", crawlRunId, e);
            run.phase = RunPhase.INTERRUPTED;
            status = "FAILED";
            notes = "exception=" + e.getClass().getSimpleName();
        } finally {
            flushQuietly(session, crawlRunId);
            heartbeat.shutdownNow();
            finishedAt = Instant.now();
            try {
                crawlRunRepository.completeCrawlRun(crawlRunId, finishedAt, status, notes);
            } catch (RuntimeException e) {
                log.error("Failed to record completion of crawl run {}", crawlRunId, e);
            }
            activeRun.compareAndSet(run, null);
            run.finished.countDown();
        }

        RunTotals totals = totals(summaries, session);
        ExtractionMetricsSnapshot extraction = metrics.snapshot();
        logSummary(crawlRunId, status, totals, extraction, summaries);
        return new CrawlRunSummary(crawlRunId, run.startedAt, finishedAt, status, run.phase, totals, extraction, summaries);
    }

    private EmployerCrawlSummary crawlEmployer(
        EmployerTarget employer,
        ExtractionMetrics metrics,
        BatchSubmitter.Session session,
        CrawlCancellation cancellation
    ) {
        FreshnessDecision decision = freshnessEvaluator.evaluate(employer.name());
        if (decision.isSkip()) {
            log.info("Skipping {}: {}", employer.name(), decision.reason());
            return EmployerCrawlSummary.skipped(employer.name(), decision.reason());
        }
        try {
            return employerCrawlerService.crawlEmployer(employer, decision, metrics, session, cancellation);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            boolean aborted = cancellation.isCancelled() || e instanceof RejectedExecutionException;
            log.warn("Employer crawl failed for {} (aborted={})", employer.name(), aborted, e);
            return new EmployerCrawlSummary(
                employer.name(),
                decision.action(),
                decision.reason(),
                0, 0, 0, 0, 0, 0,
                !aborted,
                aborted,
                Map.of("employer_crawl_exception", 1)
            );
        }
    }

    private RunProgress initialProgress(List<EmployerTarget> employers, int batchSize, boolean resume) {
        Instant now = Instant.now();
        List<String> names = employers.stream().map(EmployerTarget::name).toList();
        if (!resume) {
            log.info("Resume disabled, starting from the first of {} employers", names.size());
            return RunProgress.start(names, batchSize, now);
        }
        RunProgress stored = progressStore.load().orElse(null);
        if (stored == null) {
            return RunProgress.start(names, batchSize, now);
        }
        if (!stored.employers().equals(names)) {
            log.warn(
                "Employer list changed since last checkpoint ({} -> {} employers), resetting resume pointer",
                stored.employers().size(),
                names.size()
            );
            return RunProgress.start(names, batchSize, now);
        }
        RunProgress resumed = stored.withBatchSize(batchSize, now);
        if (resumed.isCycleComplete()) {
            log.info("Cycle {} complete, starting cycle {}", resumed.cycle(), resumed.cycle() + 1);
            return resumed.nextCycle(now);
        }
        log.info("Resuming at employer {} of {} (cycle {})", resumed.nextIndex() + 1, names.size(), resumed.cycle());
        return resumed;
    }

    private void flushQuietly(BatchSubmitter.Session session, long crawlRunId) {
        if (session.pending() == 0) {
            return;
        }
        try {
            session.flush();
        } catch (RuntimeException e) {
            log.error("Final flush failed for crawl run {}", crawlRunId, e);
        }
    }

    private RunTotals totals(List<EmployerCrawlSummary> summaries, BatchSubmitter.Session session) {
        int processed = 0;
        int skippedEmployers = 0;
        int failedEmployers = 0;
        int collected = 0;
        int inserted = 0;
        int updated = 0;
        int skipped = 0;
        int rejected = 0;
        int failed = 0;
        for (EmployerCrawlSummary summary : summaries) {
            processed++;
            if (summary.action() == CrawlAction.SKIP) {
                skippedEmployers++;
            }
            if (summary.employerFailed()) {
                failedEmployers++;
            }
            collected += summary.urlsCollected();
            inserted += summary.inserted();
            updated += summary.updated();
            skipped += summary.skipped();
            rejected += summary.rejected();
            failed += summary.failed();
        }
        return new RunTotals(
            processed,
            skippedEmployers,
            failedEmployers,
            collected,
            inserted,
            updated,
            skipped,
            rejected,
            failed,
            session.delivered(),
            session.downstreamRejected(),
            session.failedBatches()
        );
    }

    private void logSummary(
        long crawlRunId,
        String status,
        RunTotals totals,
        ExtractionMetricsSnapshot extraction,
        List<EmployerCrawlSummary> summaries
    ) {
        log.info(
            "Crawl run {} {}: employers={} (skipped={}, failed={}), collected={}, inserted={}, updated={}, skipped={}, "
                + "rejected={}, failed={}, delivered={}, downstreamRejected={}, failedBatches={}",
            crawlRunId,
            status,
            totals.employersProcessed(),
            totals.employersSkipped(),
            totals.employersFailed(),
            totals.collected(),
            totals.inserted(),
            totals.updated(),
            totals.skipped(),
            totals.rejected(),
            totals.failed(),
            totals.delivered(),
            totals.downstreamRejected(),
            totals.failedBatches()
        );
        log.info(
            "Extraction: aiCalls={}, aiSuccesses={}, aiFailures={}, fallbacks={}, tokens={}, estCostUsd={}",
            extraction.aiCalls(),
            extraction.aiSuccesses(),
            extraction.aiFailures(),
            extraction.fallbackExtractions(),
            extraction.totalTokens(),
            String.format("%.4f", extraction.estimatedCostUsd())
        );
        for (EmployerCrawlSummary summary : summaries) {
            log.info("  {} [{}] {}: errors={}", summary.employerName(), summary.action(), summary.reason(), summary.topErrors());
        }
    }

    private static final class ActiveRun {
        private final CrawlCancellation cancellation = new CrawlCancellation();
        private final CountDownLatch finished = new CountDownLatch(1);
        private volatile long crawlRunId;
        private volatile Instant startedAt;
        private volatile RunPhase phase = RunPhase.IDLE;
        private volatile String currentEmployer;
        private volatile RunProgress progress;
    }
}
