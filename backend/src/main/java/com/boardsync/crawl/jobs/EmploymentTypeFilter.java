package com.boardsync.crawl.jobs;

import com.boardsync.crawl.model.JobFields;
import com.boardsync.crawl.model.SalaryRange;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects postings that are explicitly not full-time or that only state an hourly wage.
 */
@Component
public class EmploymentTypeFilter {
    public static final String CANONICAL_FULL_TIME = "Full time";

    private static final List<String> NON_FULL_TIME_PREFIXES = List.of("part", "contract", "temp", "intern", "freelance", "seasonal");
    private static final List<String> NON_FULL_TIME_TERMS = List.of(
        "part-time", "part time", "part - time", "contractor", "contract", "temporary", "internship",
        "fixed term", "fixed-term", "freelance", "seasonal", "per diem", "hourly"
    );
    // Board category labels that some ATS templates place in the employment type slot.
    private static final Set<String> NON_FULL_TIME_LABELS = Set.of(
        "remote /", "international eor /", "international office entity /", "sales /"
    );
    private static final Pattern TITLE_MARKERS = Pattern.compile("(?i)\\b(?:intern|internship|part[- ]time|co-op|temporary)\\b");

    private final SalaryParser salaryParser;

    public EmploymentTypeFilter(SalaryParser salaryParser) {
        this.salaryParser = salaryParser;
    }

    /**
     * @return the rejection reason, or empty when the posting is acceptable as a full-time role
     */
    public Optional<String> rejectionReason(JobFields fields) {
        String type = fields.employmentType() == null ? "" : fields.employmentType().trim().toLowerCase(Locale.ROOT);
        if (!type.isEmpty()) {
            if (NON_FULL_TIME_LABELS.contains(type)) {
                return Optional.of("non_full_time:" + fields.employmentType().trim());
            }
            boolean mentionsFullTime = type.contains("full") && type.contains("time");
            if (!mentionsFullTime && NON_FULL_TIME_PREFIXES.stream().anyMatch(type::startsWith)) {
                return Optional.of("non_full_time:" + fields.employmentType().trim());
            }
            if (!mentionsFullTime && NON_FULL_TIME_TERMS.stream().anyMatch(type::contains)) {
                return Optional.of("non_full_time:" + fields.employmentType().trim());
            }
        }
        if (fields.title() != null && TITLE_MARKERS.matcher(fields.title()).find()) {
            return Optional.of("non_full_time_title");
        }
        Optional<SalaryRange> salary = salaryParser.parse(fields.salary());
        if (salary.isPresent() && salary.get().isHourly()) {
            return Optional.of("hourly_only");
        }
        return Optional.empty();
    }
}
