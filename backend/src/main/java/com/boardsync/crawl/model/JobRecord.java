package com.boardsync.crawl.model;

import java.time.Instant;

public record JobRecord(
    Long id,
    String employerName,
    String sourceUrl,
    String title,
    String company,
    String aboutCompany,
    String location,
    String alternateLocations,
    String employmentType,
    String aboutJob,
    String qualifications,
    String benefits,
    String salary,
    String workEnvironment,
    String postedDate,
    Instant scrapedAt,
    AtsType sourceEmploymentPlatform
) {
    public static JobRecord candidate(
        String employerName,
        String sourceUrl,
        JobFields fields,
        Instant scrapedAt,
        AtsType platform
    ) {
        return new JobRecord(
            null,
            employerName,
            sourceUrl,
            fields.title(),
            fields.company(),
            fields.aboutCompany(),
            fields.location(),
            fields.alternateLocations(),
            fields.employmentType(),
            fields.aboutJob(),
            fields.qualifications(),
            fields.benefits(),
            fields.salary(),
            fields.workEnvironment(),
            fields.postedDate(),
            scrapedAt,
            platform
        );
    }

    public int aboutJobLength() {
        return aboutJob == null ? 0 : aboutJob.trim().length();
    }

    public JobRecord withId(Long value) {
        return new JobRecord(value, employerName, sourceUrl, title, company, aboutCompany, location,
            alternateLocations, employmentType, aboutJob, qualifications, benefits, salary, workEnvironment,
            postedDate, scrapedAt, sourceEmploymentPlatform);
    }

    public JobRecord withSourceUrl(String value) {
        return new JobRecord(id, employerName, value, title, company, aboutCompany, location,
            alternateLocations, employmentType, aboutJob, qualifications, benefits, salary, workEnvironment,
            postedDate, scrapedAt, sourceEmploymentPlatform);
    }

    /**
     * Field-wise merge of a newer candidate into this stored record. A non-blank candidate value replaces the
     * stored one, except {@code aboutJob} where the longer text wins. Identity and id stay with this record.
     */
    public JobRecord mergedWith(JobRecord candidate) {
        return new JobRecord(
            id,
            employerName,
            sourceUrl,
            prefer(candidate.title, title),
            prefer(candidate.company, company),
            prefer(candidate.aboutCompany, aboutCompany),
            prefer(candidate.location, location),
            prefer(candidate.alternateLocations, alternateLocations),
            prefer(candidate.employmentType, employmentType),
            candidate.aboutJobLength() > aboutJobLength() ? candidate.aboutJob : aboutJob,
            prefer(candidate.qualifications, qualifications),
            prefer(candidate.benefits, benefits),
            prefer(candidate.salary, salary),
            prefer(candidate.workEnvironment, workEnvironment),
            prefer(candidate.postedDate, postedDate),
            candidate.scrapedAt == null ? scrapedAt : candidate.scrapedAt,
            candidate.sourceEmploymentPlatform == null ? sourceEmploymentPlatform : candidate.sourceEmploymentPlatform
        );
    }

    /**
     * True when every content field matches; timestamps and ids are ignored.
     */
    public boolean sameContentAs(JobRecord other) {
        return other != null
            && same(title, other.title)
            && same(company, other.company)
            && same(aboutCompany, other.aboutCompany)
            && same(location, other.location)
            && same(alternateLocations, other.alternateLocations)
            && same(employmentType, other.employmentType)
            && same(aboutJob, other.aboutJob)
            && same(qualifications, other.qualifications)
            && same(benefits, other.benefits)
            && same(salary, other.salary)
            && same(workEnvironment, other.workEnvironment)
            && same(postedDate, other.postedDate);
    }

    private static String prefer(String candidate, String current) {
        return candidate == null || candidate.isBlank() ? current : candidate;
    }

    private static boolean same(String left, String right) {
        String a = left == null ? "" : left.trim();
        String b = right == null ? "" : right.trim();
        return a.equals(b);
    }
}
