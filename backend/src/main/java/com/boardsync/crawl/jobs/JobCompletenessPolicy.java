package com.boardsync.crawl.jobs;

import com.boardsync.config.CrawlerProperties;
import com.boardsync.crawl.model.JobRecord;
import org.springframework.stereotype.Component;

/**
 * A record is complete when title, location and employment type are present and the role description is longer
 * than the configured minimum. Always evaluated against current field values.
 */
@Component
public class JobCompletenessPolicy {
    private final CrawlerProperties properties;

    public JobCompletenessPolicy(CrawlerProperties properties) {
        this.properties = properties;
    }

    public boolean isComplete(JobRecord record) {
        return record != null
            && requiredFieldsFilled(record) == 3
            && record.aboutJobLength() > properties.getExtraction().getMinAboutJobLength();
    }

    public int requiredFieldsFilled(JobRecord record) {
        int filled = 0;
        if (present(record.title())) {
            filled++;
        }
        if (present(record.location())) {
            filled++;
        }
        if (present(record.employmentType())) {
            filled++;
        }
        return filled;
    }

    /**
     * True when {@code candidate} fills more required fields than {@code stored}, or carries a longer role
     * description.
     */
    public boolean isMoreComplete(JobRecord candidate, JobRecord stored) {
        if (requiredFieldsFilled(candidate) > requiredFieldsFilled(stored)) {
            return true;
        }
        return candidate.aboutJobLength() > stored.aboutJobLength();
    }

    private boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
