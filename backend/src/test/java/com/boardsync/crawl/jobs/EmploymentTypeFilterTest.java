package com.boardsync.crawl.jobs;

import com.boardsync.crawl.model.JobFields;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EmploymentTypeFilterTest {
    private final EmploymentTypeFilter filter = new EmploymentTypeFilter(new SalaryParser());

    @Test
    void fullTimeVariantsAreAccepted() {
        assertThat(filter.rejectionReason(fields("Backend Engineer", "Full-time", null))).isEmpty();
        assertThat(filter.rejectionReason(fields("Backend Engineer", "FULL_TIME", "$150,000 - $190,000"))).isEmpty();
        assertThat(filter.rejectionReason(fields("Backend Engineer", null, null))).isEmpty();
    }

    @Test
    void explicitNonFullTimeTypesAreRejected() {
        assertThat(filter.rejectionReason(fields("Backend Engineer", "Part-time", null)))
            .contains("non_full_time:Part-time");
        assertThat(filter.rejectionReason(fields("Backend Engineer", "Contract", null)))
            .contains("non_full_time:Contract");
        assertThat(filter.rejectionReason(fields("Backend Engineer", "Remote /", null)))
            .contains("non_full_time:Remote /");
    }

    @Test
    void internTitleIsRejectedEvenWithoutType() {
        assertThat(filter.rejectionReason(fields("Software Engineering Intern", null, null)))
            .contains("non_full_time_title");
    }

    @Test
    void hourlyOnlyPayIsRejected() {
        assertThat(filter.rejectionReason(fields("Support Specialist", "Full time", "$25 - $35 per hour")))
            .contains("hourly_only");
    }

    private JobFields fields(String title, String employmentType, String salary) {
        return new JobFields(title, null, null, "Austin, TX", null, employmentType, null, null, null, salary, null, null);
    }
}
