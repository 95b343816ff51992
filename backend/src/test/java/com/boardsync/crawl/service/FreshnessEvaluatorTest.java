package com.boardsync.crawl.service;

import com.boardsync.crawl.model.CrawlAction;
import com.boardsync.crawl.model.EmployerCrawlState;
import com.boardsync.crawl.model.FreshnessDecision;
import com.boardsync.crawl.persistence.JobRecordRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FreshnessEvaluatorTest {

    @Mock
    private JobRecordRepository jobRecordRepository;

    @Test
    void unknownEmployerGetsFullCrawl() {
        when(jobRecordRepository.countByEmployer("Acme")).thenReturn(EmployerCrawlState.empty("Acme"));

        FreshnessDecision decision = new FreshnessEvaluator(jobRecordRepository).evaluate("Acme");

        assertThat(decision.action()).isEqualTo(CrawlAction.FULL_CRAWL);
        assertThat(decision.reason()).contains("first visit");
    }

    @Test
    void employerWithOnlyCompleteJobsIsSkippedRegardlessOfAge() {
        FreshnessEvaluator evaluator = new FreshnessEvaluator(jobRecordRepository);

        FreshnessDecision decision = evaluator.decide(new EmployerCrawlState("Acme", 12, 12, 0));

        assertThat(decision.isSkip()).isTrue();
        assertThat(decision.reason()).isEqualTo("all 12 known jobs complete");
    }

    @Test
    void anyIncompleteJobTriggersFullCrawl() {
        FreshnessEvaluator evaluator = new FreshnessEvaluator(jobRecordRepository);

        FreshnessDecision decision = evaluator.decide(new EmployerCrawlState("Acme", 12, 11, 1));

        assertThat(decision.action()).isEqualTo(CrawlAction.FULL_CRAWL);
        assertThat(decision.reason()).isEqualTo("1 of 12 known jobs incomplete");
    }
}
