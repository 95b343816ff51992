package com.boardsync.crawl.persistence;

import db.migration.V3__normalize_source_urls;
import org.flywaydb.core.api.migration.Context;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SourceUrlNormalizationMigrationTest {

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Autowired
    private DataSource dataSource;

    @Test
    void legacyVariantsCollapseOntoTheMostCompleteRow() throws Exception {
        String slug = "legacy" + UUID.randomUUID().toString().substring(0, 8);
        String base = "https://boards.greenhouse.io/" + slug + "/jobs/77";
        long tracked = insert(slug, base + "?utm_source=linkedin", "Engineer", "Austin, TX", "Full time", "Short.");
        long slashed = insert(slug, base + "/", "Engineer", "Austin, TX", "Full time", "x".repeat(300));
        long fragment = insert(slug, base.replace("https://boards", "HTTPS://Boards") + "#apply", "Engineer", null, null, null);
        String leverUrl = "https://jobs.lever.co/" + slug + "/abc-123";
        long untouched = insert(slug, leverUrl, "Designer", "Denver, CO", "Full time", "Design.");

        migrate();

        List<Long> survivors = jdbc.queryForList(
            """
                SELECT id
                FROM job_records
                WHERE employer_name = :employer
                  AND source_url LIKE '%/jobs/77%'
                """,
            new MapSqlParameterSource("employer", slug),
            Long.class
        );
        assertThat(survivors).containsExactly(slashed);
        assertThat(survivors).doesNotContain(tracked, fragment);
        assertEquals(base, sourceUrl(slashed));
        assertEquals(leverUrl, sourceUrl(untouched));
    }

    @Test
    void filledRequiredFieldsOutrankLongerDescription() throws Exception {
        String slug = "legacy" + UUID.randomUUID().toString().substring(0, 8);
        String base = "https://jobs.ashbyhq.com/" + slug + "/role-1";
        insert(slug, base + "?ref=careers", null, "Austin, TX", "Full time", "x".repeat(500));
        long complete = insert(slug, base + "/", "Engineer", "Austin, TX", "Full time", "Short.");

        migrate();

        List<Long> survivors = jdbc.queryForList(
            "SELECT id FROM job_records WHERE employer_name = :employer",
            new MapSqlParameterSource("employer", slug),
            Long.class
        );
        assertThat(survivors).containsExactly(complete);
        assertEquals(base, sourceUrl(complete));
    }

    private void migrate() throws Exception {
        Connection connection = DataSourceUtils.getConnection(dataSource);
        Context context = mock(Context.class);
        when(context.getConnection()).thenReturn(connection);
        new V3__normalize_source_urls().migrate(context);
    }

    private long insert(
        String employer,
        String url,
        String title,
        String location,
        String employmentType,
        String aboutJob
    ) {
        Timestamp now = Timestamp.from(Instant.now());
        jdbc.update(
            """
                INSERT INTO job_records (
                    employer_name, source_url, title, location, employment_type, about_job,
                    scraped_at, created_at, updated_at
                ) VALUES (
                    :employer, :url, :title, :location, :employmentType, :aboutJob,
                    :now, :now, :now
                )
                """,
            new MapSqlParameterSource()
                .addValue("employer", employer)
                .addValue("url", url)
                .addValue("title", title)
                .addValue("location", location)
                .addValue("employmentType", employmentType)
                .addValue("aboutJob", aboutJob)
                .addValue("now", now)
        );
        return jdbc.queryForObject(
            "SELECT id FROM job_records WHERE source_url = :url",
            new MapSqlParameterSource("url", url),
            Long.class
        );
    }

    private String sourceUrl(long id) {
        return jdbc.queryForObject(
            "SELECT source_url FROM job_records WHERE id = :id",
            new MapSqlParameterSource("id", id),
            String.class
        );
    }
}
