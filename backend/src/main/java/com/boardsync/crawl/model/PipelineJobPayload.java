package com.boardsync.crawl.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Job shape accepted by the downstream ingestion API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineJobPayload(
    String title,
    String company,
    String aboutJob,
    String salaryRange,
    String location,
    String qualifications,
    String source,
    String sourceUrl,
    String employmentType,
    String postedDate,
    String aboutCompany,
    String alternateLocations,
    String benefits,
    String workEnvironment
) {
    public static PipelineJobPayload from(JobRecord record, String source) {
        return new PipelineJobPayload(
            record.title(),
            record.company(),
            record.aboutJob(),
            record.salary(),
            record.location(),
            record.qualifications(),
            source,
            record.sourceUrl(),
            record.employmentType(),
            record.postedDate(),
            record.aboutCompany(),
            record.alternateLocations(),
            record.benefits(),
            record.workEnvironment()
        );
    }
}
