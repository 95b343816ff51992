package com.boardsync.crawl.model;

import java.util.function.UnaryOperator;

/**
 * Candidate field values produced by one extraction layer (AI, JSON-LD, selectors or section parsing).
 * Any field may be null.
 */
public record JobFields(
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
    String postedDate
) {
    public static JobFields empty() {
        return new JobFields(null, null, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean hasTitle() {
        return !isBlank(title);
    }

    public boolean isEmpty() {
        return isBlank(title) && isBlank(location) && isBlank(aboutJob) && isBlank(employmentType);
    }

    /**
     * Keeps this layer's values and fills blanks from {@code fallback}.
     */
    public JobFields orElse(JobFields fallback) {
        if (fallback == null) {
            return this;
        }
        return new JobFields(
            pick(title, fallback.title),
            pick(company, fallback.company),
            pick(aboutCompany, fallback.aboutCompany),
            pick(location, fallback.location),
            pick(alternateLocations, fallback.alternateLocations),
            pick(employmentType, fallback.employmentType),
            pick(aboutJob, fallback.aboutJob),
            pick(qualifications, fallback.qualifications),
            pick(benefits, fallback.benefits),
            pick(salary, fallback.salary),
            pick(workEnvironment, fallback.workEnvironment),
            pick(postedDate, fallback.postedDate)
        );
    }

    public JobFields map(UnaryOperator<String> operator) {
        return new JobFields(
            operator.apply(title),
            operator.apply(company),
            operator.apply(aboutCompany),
            operator.apply(location),
            operator.apply(alternateLocations),
            operator.apply(employmentType),
            operator.apply(aboutJob),
            operator.apply(qualifications),
            operator.apply(benefits),
            operator.apply(salary),
            operator.apply(workEnvironment),
            operator.apply(postedDate)
        );
    }

    public JobFields withCompany(String value) {
        return new JobFields(title, value, aboutCompany, location, alternateLocations, employmentType, aboutJob,
            qualifications, benefits, salary, workEnvironment, postedDate);
    }

    public JobFields withEmploymentType(String value) {
        return new JobFields(title, company, aboutCompany, location, alternateLocations, value, aboutJob,
            qualifications, benefits, salary, workEnvironment, postedDate);
    }

    private static String pick(String primary, String fallback) {
        return isBlank(primary) ? fallback : primary;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
