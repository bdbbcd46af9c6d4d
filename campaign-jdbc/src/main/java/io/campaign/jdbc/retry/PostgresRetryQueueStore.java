package io.campaign.jdbc.retry;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.RetryEntry;
import io.campaign.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * PostgreSQL retry queue store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for a single-round-trip claim.
 */
public final class PostgresRetryQueueStore extends AbstractJdbcRetryQueueStore {

  public PostgresRetryQueueStore() {
    super();
  }

  public PostgresRetryQueueStore(TableNames tables, JsonCodec jsonCodec) {
    super(tables, jsonCodec);
  }

  @Override
  public AbstractJdbcRetryQueueStore with(TableNames tables, JsonCodec jsonCodec) {
    return new PostgresRetryQueueStore(tables, jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<RetryEntry> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=?"
        + " WHERE entry_id IN (SELECT entry_id FROM " + tableName()
        + " WHERE " + dueCondition() + " AND (locked_by IS NULL OR locked_at < ?)"
        + " ORDER BY next_retry_at, entry_id LIMIT ? FOR UPDATE SKIP LOCKED)"
        + " RETURNING " + COLUMNS;
    List<RetryEntry> claimed = JdbcTemplate.updateReturning(conn, sql, rowMapper(),
        ownerId, nowMs, now, lockExpiry, limit);
    // RETURNING does not preserve the sub-select's order
    return claimed.stream()
        .sorted(Comparator.comparing(RetryEntry::nextRetryAt).thenComparing(RetryEntry::entryId))
        .toList();
  }
}
