package db.migration;

import com.boardsync.crawl.util.JobUrlUtils;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Rewrites stored source URLs to their normalized form. Where several rows collapse onto one URL the most
 * complete row survives and the rest are deleted.
 */
public class V3__normalize_source_urls extends BaseJavaMigration {

  @Override
  public void migrate(Context context) throws Exception {
    Connection connection = context.getConnection();
    Map<String, List<Row>> byUrl = new LinkedHashMap<>();
    try (Statement statement = connection.createStatement();
        ResultSet rs =
            statement.executeQuery(
                "SELECT id, source_url, title, location, employment_type, about_job "
                    + "FROM job_records ORDER BY id")) {
      while (rs.next()) {
        Row row =
            new Row(
                rs.getLong("id"),
                rs.getString("source_url"),
                rs.getString("title"),
                rs.getString("location"),
                rs.getString("employment_type"),
                rs.getString("about_job"));
        String normalized = JobUrlUtils.normalize(row.sourceUrl);
        byUrl.computeIfAbsent(normalized == null ? row.sourceUrl : normalized, k -> new ArrayList<>()).add(row);
      }
    }

    List<Long> toDelete = new ArrayList<>();
    Map<Long, String> toRewrite = new LinkedHashMap<>();
    for (Map.Entry<String, List<Row>> entry : byUrl.entrySet()) {
      Row keep = null;
      for (Row row : entry.getValue()) {
        if (keep == null || row.betterThan(keep)) {
          keep = row;
        }
      }
      for (Row row : entry.getValue()) {
        if (row != keep) {
          toDelete.add(row.id);
        }
      }
      if (!Objects.equals(keep.sourceUrl, entry.getKey())) {
        toRewrite.put(keep.id, entry.getKey());
      }
    }

    delete(connection, toDelete);
    rewrite(connection, toRewrite);
  }

  private void delete(Connection connection, List<Long> ids) throws SQLException {
    if (ids.isEmpty()) {
      return;
    }
    try (PreparedStatement ps = connection.prepareStatement("DELETE FROM job_records WHERE id = ?")) {
      for (Long id : ids) {
        ps.setLong(1, id);
        ps.addBatch();
      }
      ps.executeBatch();
    }
  }

  private void rewrite(Connection connection, Map<Long, String> urls) throws SQLException {
    if (urls.isEmpty()) {
      return;
    }
    try (PreparedStatement ps =
        connection.prepareStatement("UPDATE job_records SET source_url = ? WHERE id = ?")) {
      for (Map.Entry<Long, String> entry : urls.entrySet()) {
        ps.setString(1, entry.getValue());
        ps.setLong(2, entry.getKey());
        ps.addBatch();
      }
      ps.executeBatch();
    }
  }

  private static final class Row {
    private final long id;
    private final String sourceUrl;
    private final int requiredFilled;
    private final int aboutJobLength;

    private Row(long id, String sourceUrl, String title, String location, String employmentType, String aboutJob) {
      this.id = id;
      this.sourceUrl = sourceUrl;
      this.requiredFilled = filled(title) + filled(location) + filled(employmentType);
      this.aboutJobLength = aboutJob == null ? 0 : aboutJob.trim().length();
    }

    private boolean betterThan(Row other) {
      if (requiredFilled != other.requiredFilled) {
        return requiredFilled > other.requiredFilled;
      }
      return aboutJobLength > other.aboutJobLength;
    }

    private static int filled(String value) {
      return value == null || value.isBlank() ? 0 : 1;
    }
  }
}
