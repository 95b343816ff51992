package com.boardsync.crawl.service;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.jobs.JobCompletenessPolicy;
import com.boardsync.crawl.model.AtsType;
import com.boardsync.crawl.model.JobRecord;
import com.boardsync.crawl.model.MergeOutcome;
import com.boardsync.crawl.model.MergeResult;
import com.boardsync.crawl.persistence.JobRecordRepository;
import com.boardsync.crawl.persistence.StoreConstraintViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobMergeServiceTest {
    private static final String URL = "https://boards.greenhouse.io/acme/jobs/101";
    private static final String LONG_ABOUT = "Design and operate the payment ledger services used by every product team.";

    @Mock
    private JobRecordRepository repository;

    private JobMergeService service;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getExtraction().setMinAboutJobLength(20);
        service = new JobMergeService(repository, new JobCompletenessPolicy(properties));
    }

    @Test
    void newUrlIsInsertedUnderItsNormalizedForm() {
        when(repository.findByUrl(URL)).thenReturn(Optional.empty());
        when(repository.insert(any())).thenAnswer(invocation -> ((JobRecord) invocation.getArgument(0)).withId(7L));

        MergeResult result = service.merge(record(null, URL + "/?utm_source=x", "Engineer", "Austin, TX", "Full time", LONG_ABOUT));

        assertThat(result.outcome()).isEqualTo(MergeOutcome.INSERT);
        assertThat(result.forwarded()).isTrue();
        assertThat(result.record().id()).isEqualTo(7L);
        assertThat(result.record().sourceUrl()).isEqualTo(URL);
    }

    @Test
    void completeStoredRecordIsNeverOverwritten() {
        JobRecord stored = record(3L, URL, "Engineer", "Austin, TX", "Full time", LONG_ABOUT);
        when(repository.findByUrl(URL)).thenReturn(Optional.of(stored));

        MergeResult result = service.merge(record(null, URL, "Senior Engineer", "Austin, TX", "Full time", LONG_ABOUT + " More text."));

        assertThat(result.outcome()).isEqualTo(MergeOutcome.SKIP);
        assertThat(result.reason()).isEqualTo("already_complete");
        assertThat(result.forwarded()).isFalse();
        verify(repository, never()).update(any());
    }

    @Test
    void incompleteStoredRecordIsUpdatedByMoreCompleteCandidate() {
        JobRecord stored = record(3L, URL, "Engineer", null, "Full time", "Short");
        when(repository.findByUrl(URL)).thenReturn(Optional.of(stored));

        MergeResult result = service.merge(record(null, URL, "Engineer", "Austin, TX", "Full time", LONG_ABOUT));

        assertThat(result.outcome()).isEqualTo(MergeOutcome.UPDATE);
        ArgumentCaptor<JobRecord> captor = ArgumentCaptor.forClass(JobRecord.class);
        verify(repository).update(captor.capture());
        assertThat(captor.getValue().id()).isEqualTo(3L);
        assertThat(captor.getValue().location()).isEqualTo("Austin, TX");
        assertThat(captor.getValue().aboutJob()).isEqualTo(LONG_ABOUT);
    }

    @Test
    void lessCompleteCandidateDoesNotDegradeStoredRecord() {
        JobRecord stored = record(3L, URL, "Engineer", "Austin, TX", null, "Medium length text");
        when(repository.findByUrl(URL)).thenReturn(Optional.of(stored));

        MergeResult result = service.merge(record(null, URL, "Engineer", null, null, "Short"));

        assertThat(result.outcome()).isEqualTo(MergeOutcome.SKIP);
        assertThat(result.reason()).isEqualTo("not_more_complete");
        verify(repository, never()).update(any());
    }

    @Test
    void mergingTheSameCandidateTwiceOnlyWritesOnce() {
        JobRecord candidate = record(null, URL, "Engineer", "Austin, TX", "Full time", LONG_ABOUT);
        when(repository.findByUrl(URL))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(candidate.withId(5L)));
        when(repository.insert(any())).thenAnswer(invocation -> ((JobRecord) invocation.getArgument(0)).withId(5L));

        MergeResult first = service.merge(candidate);
        MergeResult second = service.merge(candidate);

        assertThat(first.outcome()).isEqualTo(MergeOutcome.INSERT);
        assertThat(second.outcome()).isEqualTo(MergeOutcome.SKIP);
        verify(repository, never()).update(any());
    }

    @Test
    void constraintViolationOnInsertFallsBackToUpdatePath() {
        JobRecord stored = record(9L, URL, "Engineer", null, null, "Short");
        when(repository.findByUrl(URL))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(stored));
        when(repository.insert(any())).thenThrow(new StoreConstraintViolationException(URL, null));

        MergeResult result = service.merge(record(null, URL, "Engineer", "Austin, TX", "Full time", LONG_ABOUT));

        assertThat(result.outcome()).isEqualTo(MergeOutcome.UPDATE);
        verify(repository).update(any());
    }

    private JobRecord record(Long id, String url, String title, String location, String employmentType, String aboutJob) {
        return new JobRecord(
            id,
            "Acme",
            url,
            title,
            "Acme",
            null,
            location,
            null,
            employmentType,
            aboutJob,
            null,
            null,
            null,
            null,
            null,
            Instant.parse("2026-01-10T00:00:00Z"),
            AtsType.GREENHOUSE
        );
    }
}
