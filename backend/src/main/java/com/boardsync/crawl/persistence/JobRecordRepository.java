package com.boardsync.crawl.persistence;

import com.boardsync.crawl.jobs.JobCompletenessPolicy;
import com.boardsync.crawl.model.AtsType;
import com.boardsync.crawl.model.EmployerCrawlState;
import com.boardsync.crawl.model.JobRecord;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
public class JobRecordRepository {
    private static final String COLUMNS = """
        id, employer_name, source_url, title, company, about_company, location, alternate_locations,
        employment_type, about_job, qualifications, benefits, salary, work_environment, posted_date,
        scraped_at, source_employment_platform
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final JobCompletenessPolicy completenessPolicy;

    public JobRecordRepository(NamedParameterJdbcTemplate jdbc, JobCompletenessPolicy completenessPolicy) {
        this.jdbc = jdbc;
        this.completenessPolicy = completenessPolicy;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Optional<JobRecord> findByUrl(String sourceUrl) {
        if (sourceUrl == null) {
            return Optional.empty();
        }
        List<JobRecord> rows = jdbc.query(
            "SELECT " + COLUMNS + " FROM job_records WHERE source_url = :sourceUrl",
            new MapSqlParameterSource("sourceUrl", sourceUrl),
            jobRecordRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<JobRecord> findByEmployer(String employerName) {
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM job_records WHERE employer_name = :employerName ORDER BY id",
            new MapSqlParameterSource("employerName", employerName),
            jobRecordRowMapper()
        );
    }

    /**
     * Summarizes the employer's stored records, evaluating completeness against their current field values.
     */
    public EmployerCrawlState countByEmployer(String employerName) {
        int total = 0;
        int complete = 0;
        for (JobRecord record : findByEmployer(employerName)) {
            total++;
            if (completenessPolicy.isComplete(record)) {
                complete++;
            }
        }
        return new EmployerCrawlState(employerName, total, complete, total - complete);
    }

    /**
     * @throws StoreConstraintViolationException when a record with the same source URL already exists
     */
    public JobRecord insert(JobRecord record) {
        Instant now = Instant.now();
        MapSqlParameterSource params = contentParams(record)
            .addValue("employerName", record.employerName())
            .addValue("sourceUrl", record.sourceUrl())
            .addValue("createdAt", toTimestamp(now))
            .addValue("updatedAt", toTimestamp(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbc.update(
                """
                    INSERT INTO job_records (
                        employer_name, source_url, title, company, about_company, location, alternate_locations,
                        employment_type, about_job, qualifications, benefits, salary, work_environment, posted_date,
                        scraped_at, source_employment_platform, created_at, updated_at
                    )
                    VALUES (
                        :employerName, :sourceUrl, :title, :company, :aboutCompany, :location, :alternateLocations,
                        :employmentType, :aboutJob, :qualifications, :benefits, :salary, :workEnvironment, :postedDate,
                        :scrapedAt, :platform, :createdAt, :updatedAt
                    )
                    """,
                params,
                keyHolder,
                new String[]{"id"}
            );
        } catch (DuplicateKeyException e) {
            throw new StoreConstraintViolationException(record.sourceUrl(), e);
        }
        Number key = keyHolder.getKey();
        if (key == null) {
            return findByUrl(record.sourceUrl())
                .orElseThrow(() -> new IllegalStateException("Failed to insert job record " + record.sourceUrl()));
        }
        return record.withId(key.longValue());
    }

    public void update(JobRecord record) {
        if (record.id() == null) {
            throw new IllegalArgumentException("Cannot update a job record without id: " + record.sourceUrl());
        }
        MapSqlParameterSource params = contentParams(record)
            .addValue("id", record.id())
            .addValue("updatedAt", toTimestamp(Instant.now()));
        jdbc.update(
            """
                UPDATE job_records
                SET title = :title,
                    company = :company,
                    about_company = :aboutCompany,
                    location = :location,
                    alternate_locations = :alternateLocations,
                    employment_type = :employmentType,
                    about_job = :aboutJob,
                    qualifications = :qualifications,
                    benefits = :benefits,
                    salary = :salary,
                    work_environment = :workEnvironment,
                    posted_date = :postedDate,
                    scraped_at = :scrapedAt,
                    source_employment_platform = :platform,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params
        );
    }

    public List<JobRecord> findBatchAfterId(long lastId, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lastId", lastId)
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            "SELECT " + COLUMNS + " FROM job_records WHERE id > :lastId ORDER BY id LIMIT :limit",
            params,
            jobRecordRowMapper()
        );
    }

    public int deleteByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        return jdbc.update("DELETE FROM job_records WHERE id IN (:ids)", new MapSqlParameterSource("ids", ids));
    }

    public long countAll() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM job_records", Long.class);
        return count == null ? 0L : count;
    }

    public long countEmployers() {
        Long count = jdbc.getJdbcTemplate().queryForObject(
            "SELECT COUNT(DISTINCT employer_name) FROM job_records",
            Long.class
        );
        return count == null ? 0L : count;
    }

    private MapSqlParameterSource contentParams(JobRecord record) {
        return new MapSqlParameterSource()
            .addValue("title", record.title())
            .addValue("company", record.company())
            .addValue("aboutCompany", record.aboutCompany())
            .addValue("location", record.location())
            .addValue("alternateLocations", record.alternateLocations())
            .addValue("employmentType", record.employmentType())
            .addValue("aboutJob", record.aboutJob())
            .addValue("qualifications", record.qualifications())
            .addValue("benefits", record.benefits())
            .addValue("salary", record.salary())
            .addValue("workEnvironment", record.workEnvironment())
            .addValue("postedDate", record.postedDate())
            .addValue("scrapedAt", toTimestamp(record.scrapedAt() == null ? Instant.now() : record.scrapedAt()))
            .addValue("platform", record.sourceEmploymentPlatform() == null ? null : record.sourceEmploymentPlatform().name());
    }

    private RowMapper<JobRecord> jobRecordRowMapper() {
        return (rs, rowNum) -> new JobRecord(
            rs.getLong("id"),
            rs.getString("employer_name"),
            rs.getString("source_url"),
            rs.getString("title"),
            rs.getString("company"),
            rs.getString("about_company"),
            rs.getString("location"),
            rs.getString("alternate_locations"),
            rs.getString("employment_type"),
            rs.getString("about_job"),
            rs.getString("qualifications"),
            rs.getString("benefits"),
            rs.getString("salary"),
            rs.getString("work_environment"),
            rs.getString("posted_date"),
            toInstant(rs.getTimestamp("scraped_at")),
            parseAtsType(rs.getString("source_employment_platform"))
        );
    }

    private AtsType parseAtsType(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return AtsType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return AtsType.GENERIC;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
