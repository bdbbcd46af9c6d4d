package io.campaign.jdbc.store;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.AbTest;
import io.campaign.model.AbTestOutcome;
import io.campaign.model.AbTestStatus;
import io.campaign.spi.AbTestStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC A/B test store. The metric list is stored comma-separated.
 */
public final class JdbcAbTestStore implements AbTestStore {
  private static final String COLUMNS = "test_id, campaign_id, variant_a, variant_b, split_ratio, metrics, "
      + "status, winner, created_at, completed_at";

  private static final JdbcTemplate.RowMapper<AbTest> ROW_MAPPER = rs -> new AbTest(
      rs.getString("test_id"),
      rs.getString("campaign_id"),
      rs.getString("variant_a"),
      rs.getString("variant_b"),
      rs.getDouble("split_ratio"),
      metrics(rs.getString("metrics")),
      AbTestStatus.fromCode(rs.getInt("status")),
      AbTestOutcome.fromCode(rs.getString("winner")),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "completed_at"));

  private final TableNames tables;

  public JdbcAbTestStore() {
    this(TableNames.DEFAULTS);
  }

  public JdbcAbTestStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public void insert(Connection conn, AbTest test) {
    String sql = "INSERT INTO " + tables.abTests() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        test.testId(), test.campaignId(), test.variantA(), test.variantB(), test.splitRatio(),
        String.join(",", test.metrics()), test.status().code(),
        test.winner() == null ? null : test.winner().code(), test.createdAt(), test.completedAt());
  }

  @Override
  public Optional<AbTest> find(Connection conn, String testId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables.abTests() + " WHERE test_id=?";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, testId);
  }

  @Override
  public Optional<AbTest> findLatestByCampaign(Connection conn, String campaignId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables.abTests()
        + " WHERE campaign_id=? ORDER BY created_at DESC, test_id LIMIT 1";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, campaignId);
  }

  @Override
  public int complete(Connection conn, String testId, AbTestOutcome winner, Instant now) {
    String sql = "UPDATE " + tables.abTests() + " SET status=" + AbTestStatus.COMPLETED.code()
        + ", winner=?, completed_at=? WHERE test_id=? AND status=" + AbTestStatus.ACTIVE.code();
    return JdbcTemplate.update(conn, sql, winner.code(), now, testId);
  }

  private static List<String> metrics(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
