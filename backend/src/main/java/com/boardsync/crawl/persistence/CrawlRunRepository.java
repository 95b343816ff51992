package com.boardsync.crawl.persistence;

import com.boardsync.crawl.model.CrawlRunMeta;
import com.boardsync.crawl.model.RunTotals;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class CrawlRunRepository {
    private final NamedParameterJdbcTemplate jdbc;

    public CrawlRunRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertCrawlRun(Instant startedAt, String status, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("status", status)
            .addValue("notes", notes)
            .addValue("lastHeartbeatAt", toTimestamp(startedAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO crawl_runs (started_at, status, notes, last_heartbeat_at)
                VALUES (:startedAt, :status, :notes, :lastHeartbeatAt)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        Long id = key == null ? null : key.longValue();
        if (id == null) {
            id = jdbc.queryForObject(
                """
                    SELECT id
                    FROM crawl_runs
                    WHERE started_at = :startedAt
                      AND status = :status
                    ORDER BY id DESC
                    LIMIT 1
                    """,
                params,
                Long.class
            );
            if (id == null) {
                throw new IllegalStateException("Failed to insert crawl run");
            }
        }
        return id;
    }

    public void updateCrawlRunProgress(long crawlRunId, RunTotals totals, Instant heartbeatAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("processed", totals.employersProcessed())
            .addValue("skipped", totals.employersSkipped())
            .addValue("failed", totals.employersFailed())
            .addValue("inserted", totals.inserted())
            .addValue("updated", totals.updated())
            .addValue("recordsSkipped", totals.skipped())
            .addValue("delivered", totals.delivered())
            .addValue("lastHeartbeatAt", toTimestamp(heartbeatAt));
        jdbc.update(
            """
                UPDATE crawl_runs
                SET employers_processed = :processed,
                    employers_skipped = :skipped,
                    employers_failed = :failed,
                    records_inserted = :inserted,
                    records_updated = :updated,
                    records_skipped = :recordsSkipped,
                    records_delivered = :delivered,
                    last_heartbeat_at = COALESCE(:lastHeartbeatAt, last_heartbeat_at)
                WHERE id = :crawlRunId
                """,
            params
        );
    }

    public void completeCrawlRun(long crawlRunId, Instant finishedAt, String status, String notes) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("notes", notes)
            .addValue("lastHeartbeatAt", toTimestamp(finishedAt));
        jdbc.update(
            """
                UPDATE crawl_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    notes = :notes,
                    last_heartbeat_at = COALESCE(:lastHeartbeatAt, last_heartbeat_at)
                WHERE id = :crawlRunId
                """,
            params
        );
    }

    public void updateCrawlRunHeartbeat(long crawlRunId, Instant heartbeatAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("lastHeartbeatAt", toTimestamp(heartbeatAt));
        jdbc.update(
            """
                UPDATE crawl_runs
                SET last_heartbeat_at = COALESCE(:lastHeartbeatAt, last_heartbeat_at)
                WHERE id = :crawlRunId
                """,
            params
        );
    }

    public CrawlRunMeta findMostRecentCrawlRun() {
        List<CrawlRunMeta> runs = jdbc.query(
            """
                SELECT id, started_at, finished_at, status
                FROM crawl_runs
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            crawlRunMetaRowMapper()
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public CrawlRunMeta findCrawlRunById(long crawlRunId) {
        List<CrawlRunMeta> runs = jdbc.query(
            """
                SELECT id, started_at, finished_at, status
                FROM crawl_runs
                WHERE id = :crawlRunId
                """,
            new MapSqlParameterSource("crawlRunId", crawlRunId),
            crawlRunMetaRowMapper()
        );
        return runs.isEmpty() ? null : runs.get(0);
    }

    public List<CrawlRunMeta> findRunningCrawlRuns() {
        return jdbc.query(
            """
                SELECT id, started_at, finished_at, status
                FROM crawl_runs
                WHERE status = 'RUNNING'
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource(),
            crawlRunMetaRowMapper()
        );
    }

    /**
     * RUNNING rows whose heartbeat is newer than {@code heartbeatCutoff}. Older RUNNING rows belong to processes that
     * died without closing their run.
     */
    public List<CrawlRunMeta> findActiveCrawlRuns(Instant heartbeatCutoff) {
        return jdbc.query(
            """
                SELECT id, started_at, finished_at, status
                FROM crawl_runs
                WHERE status = 'RUNNING'
                  AND last_heartbeat_at >= :cutoff
                ORDER BY started_at ASC, id ASC
                """,
            new MapSqlParameterSource("cutoff", toTimestamp(heartbeatCutoff)),
            crawlRunMetaRowMapper()
        );
    }

    public void insertFailedSubmission(Long crawlRunId, Instant failedAt, int attempts, List<String> sourceUrls, String lastError) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("crawlRunId", crawlRunId)
            .addValue("failedAt", toTimestamp(failedAt))
            .addValue("attempts", attempts)
            .addValue("batchSize", sourceUrls.size())
            .addValue("sourceUrls", String.join("\n", sourceUrls))
            .addValue("lastError", truncate(lastError));
        jdbc.update(
            """
                INSERT INTO failed_submissions (crawl_run_id, failed_at, attempts, batch_size, source_urls, last_error)
                VALUES (:crawlRunId, :failedAt, :attempts, :batchSize, :sourceUrls, :lastError)
                """,
            params
        );
    }

    public List<String> findFailedSubmissionUrls(long crawlRunId) {
        List<String> blobs = jdbc.queryForList(
            "SELECT source_urls FROM failed_submissions WHERE crawl_run_id = :crawlRunId ORDER BY id",
            new MapSqlParameterSource("crawlRunId", crawlRunId),
            String.class
        );
        return blobs.stream()
            .flatMap(blob -> blob.lines())
            .filter(line -> !line.isBlank())
            .toList();
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("crawl_runs", countTable("crawl_runs"));
        counts.put("failed_submissions", countTable("failed_submissions"));
        return counts;
    }

    private long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    private RowMapper<CrawlRunMeta> crawlRunMetaRowMapper() {
        return (rs, rowNum) -> new CrawlRunMeta(
            rs.getLong("id"),
            rs.getTimestamp("started_at").toInstant(),
            rs.getTimestamp("finished_at") == null ? null : rs.getTimestamp("finished_at").toInstant(),
            rs.getString("status")
        );
    }

    private String truncate(String detail) {
        if (detail == null || detail.length() <= 1000) {
            return detail;
        }
        return detail.substring(0, 1000);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
