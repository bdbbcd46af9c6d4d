package io.campaign.jdbc.store;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.RecipientPreferences;
import io.campaign.model.SegmentFilter;
import io.campaign.spi.RecipientStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC recipient store. Filter dimensions are AND-ed; values within an allow-list are OR-ed.
 */
public final class JdbcRecipientStore implements RecipientStore {

  private final TableNames tables;

  public JdbcRecipientStore() {
    this(TableNames.DEFAULTS);
  }

  public JdbcRecipientStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public List<String> findIds(Connection conn, SegmentFilter filter, String afterId, int limit) {
    StringBuilder sql = new StringBuilder("SELECT recipient_id FROM ")
        .append(tables.recipients()).append(" WHERE 1=1");
    List<Object> params = new ArrayList<>();
    if (filter.minActivityScore() != null) {
      sql.append(" AND activity_score >= ?");
      params.add(filter.minActivityScore());
    }
    appendIn(sql, params, "tier", filter.tiers());
    appendIn(sql, params, "country", filter.countries());
    appendIn(sql, params, "language", filter.languages());
    if (filter.registeredAfter() != null) {
      sql.append(" AND registered_at >= ?");
      params.add(filter.registeredAfter());
    }
    if (filter.registeredBefore() != null) {
      sql.append(" AND registered_at <= ?");
      params.add(filter.registeredBefore());
    }
    if (afterId != null) {
      sql.append(" AND recipient_id > ?");
      params.add(afterId);
    }
    sql.append(" ORDER BY recipient_id LIMIT ?");
    params.add(limit);
    return JdbcTemplate.query(conn, sql.toString(), rs -> rs.getString(1), params.toArray());
  }

  @Override
  public Optional<RecipientPreferences> findPreferences(Connection conn, String recipientId) {
    String sql = "SELECT recipient_id, opted_out, sends_this_week, max_sends_per_week FROM "
        + tables.recipients() + " WHERE recipient_id=?";
    return JdbcTemplate.queryOne(conn, sql, rs -> new RecipientPreferences(
        rs.getString("recipient_id"),
        rs.getBoolean("opted_out"),
        rs.getInt("sends_this_week"),
        JdbcTemplate.nullableInt(rs, "max_sends_per_week")), recipientId);
  }

  @Override
  public int incrementWeeklySends(Connection conn, String recipientId, Instant sentAt) {
    String sql = "UPDATE " + tables.recipients()
        + " SET sends_this_week = sends_this_week + 1, last_sent_at=? WHERE recipient_id=?";
    return JdbcTemplate.update(conn, sql, sentAt, recipientId);
  }

  @Override
  public int updateOptOut(Connection conn, String recipientId, boolean optedOut, String reason, Instant now) {
    String sql = "UPDATE " + tables.recipients()
        + " SET opted_out=?, opted_out_reason=?, opted_out_at=? WHERE recipient_id=?";
    return JdbcTemplate.update(conn, sql, optedOut, optedOut ? reason : null, optedOut ? now : null, recipientId);
  }

  private static void appendIn(StringBuilder sql, List<Object> params, String column, Collection<String> values) {
    if (values.isEmpty()) {
      return;
    }
    sql.append(" AND ").append(column).append(" IN (");
    boolean first = true;
    for (String value : values) {
      if (!first) {
        sql.append(',');
      }
      sql.append('?');
      params.add(value);
      first = false;
    }
    sql.append(')');
  }
}
