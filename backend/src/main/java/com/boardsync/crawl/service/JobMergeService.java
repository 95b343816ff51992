package com.boardsync.crawl.service;

import com.boardsync.crawl.jobs.JobCompletenessPolicy;
import com.boardsync.crawl.model.JobRecord;
import com.boardsync.crawl.model.MergeOutcome;
import com.boardsync.crawl.model.MergeResult;
import com.boardsync.crawl.persistence.JobRecordRepository;
import com.boardsync.crawl.persistence.StoreConstraintViolationException;
import com.boardsync.crawl.util.JobUrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Dedup engine. The normalized source URL is the only identity key: a candidate is inserted when the URL is new,
 * merged into the stored record when it is more complete, and skipped otherwise. Only INSERT and UPDATE results are
 * meant for downstream delivery.
 */
@Service
public class JobMergeService {
    private static final Logger log = LoggerFactory.getLogger(JobMergeService.class);
    private static final int LOCK_STRIPES = 64;

    private final JobRecordRepository jobRecordRepository;
    private final JobCompletenessPolicy completenessPolicy;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public JobMergeService(JobRecordRepository jobRecordRepository, JobCompletenessPolicy completenessPolicy) {
        this.jobRecordRepository = jobRecordRepository;
        this.completenessPolicy = completenessPolicy;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    public MergeResult merge(JobRecord candidate) {
        String url = JobUrlUtils.normalize(candidate.sourceUrl());
        if (url == null) {
            throw new IllegalArgumentException("Candidate has no source URL");
        }
        JobRecord normalized = candidate.withSourceUrl(url);
        synchronized (lockFor(url)) {
            Optional<JobRecord> existing = jobRecordRepository.findByUrl(url);
            if (existing.isEmpty()) {
                try {
                    JobRecord inserted = jobRecordRepository.insert(normalized);
                    return new MergeResult(MergeOutcome.INSERT, inserted, "new_url");
                } catch (StoreConstraintViolationException e) {
                    log.error("Store rejected insert of {} although no record was found for it; falling back to update", url, e);
                    existing = jobRecordRepository.findByUrl(url);
                    if (existing.isEmpty()) {
                        throw e;
                    }
                }
            }
            return mergeInto(existing.get(), normalized);
        }
    }

    private MergeResult mergeInto(JobRecord stored, JobRecord candidate) {
        if (completenessPolicy.isComplete(stored)) {
            return new MergeResult(MergeOutcome.SKIP, stored, "already_complete");
        }
        if (!completenessPolicy.isMoreComplete(candidate, stored)) {
            return new MergeResult(MergeOutcome.SKIP, stored, "not_more_complete");
        }
        JobRecord merged = stored.mergedWith(candidate);
        if (merged.sameContentAs(stored)) {
            return new MergeResult(MergeOutcome.SKIP, stored, "no_content_change");
        }
        jobRecordRepository.update(merged);
        return new MergeResult(MergeOutcome.UPDATE, merged, "more_complete");
    }

    private Object lockFor(String url) {
        return locks[Math.floorMod(url.hashCode(), LOCK_STRIPES)];
    }
}
