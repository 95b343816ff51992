package com.boardsync.crawl.service;

import com.boardsync.crawl.model.EmployerCrawlState;
import com.boardsync.crawl.model.FreshnessDecision;
import com.boardsync.crawl.persistence.JobRecordRepository;
import org.springframework.stereotype.Service;

/**
 * Decides whether an employer needs crawling. Only missing data triggers a crawl; the age of stored records
 * never does.
 */
@Service
public class FreshnessEvaluator {
    private final JobRecordRepository jobRecordRepository;

    public FreshnessEvaluator(JobRecordRepository jobRecordRepository) {
        this.jobRecordRepository = jobRecordRepository;
    }

    public FreshnessDecision evaluate(String employerName) {
        return decide(jobRecordRepository.countByEmployer(employerName));
    }

    public FreshnessDecision decide(EmployerCrawlState state) {
        if (state.totalJobs() == 0) {
            return FreshnessDecision.fullCrawl(state, "no known jobs, first visit");
        }
        if (state.incompleteJobs() == 0) {
            return FreshnessDecision.skip(state, "all " + state.totalJobs() + " known jobs complete");
        }
        return FreshnessDecision.fullCrawl(
            state,
            state.incompleteJobs() + " of " + state.totalJobs() + " known jobs incomplete"
        );
    }
}
