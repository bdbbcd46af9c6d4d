package io.campaign.jdbc.retry;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.RetryEntry;
import io.campaign.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * MySQL retry queue store. Also compatible with TiDB.
 *
 * <p>Uses {@code UPDATE...ORDER BY...LIMIT} for the claim followed by a {@code SELECT} of the
 * claimed rows. Both phases run in the caller's transaction, so the row locks taken by the
 * {@code UPDATE} keep other drainers off the claimed entries until commit.
 */
public final class MySqlRetryQueueStore extends AbstractJdbcRetryQueueStore {

  public MySqlRetryQueueStore() {
    super();
  }

  public MySqlRetryQueueStore(TableNames tables, JsonCodec jsonCodec) {
    super(tables, jsonCodec);
  }

  @Override
  public AbstractJdbcRetryQueueStore with(TableNames tables, JsonCodec jsonCodec) {
    return new MySqlRetryQueueStore(tables, jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public List<RetryEntry> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    Objects.requireNonNull(ownerId, "ownerId");
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    // MySQL supports UPDATE...ORDER BY...LIMIT (no self-referencing subquery allowed)
    String claimSql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=?"
        + " WHERE " + dueCondition() + " AND (locked_by IS NULL OR locked_at < ?)"
        + " ORDER BY next_retry_at, entry_id LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql, ownerId, nowMs, now, lockExpiry, limit);
    if (updated == 0) return List.of();
    return selectClaimed(conn, ownerId, nowMs);
  }
}
