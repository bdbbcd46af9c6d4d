package io.campaign.jdbc.retry;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.CampaignStatus;
import io.campaign.model.ErrorClass;
import io.campaign.model.RetryEntry;
import io.campaign.model.RetryStatus;
import io.campaign.model.Variant;
import io.campaign.spi.RetryQueueStore;
import io.campaign.util.ErrorHistoryCodec;
import io.campaign.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC retry queue store with standard SQL implementations.
 *
 * <p>Subclasses override {@link #claimDue} to provide database-specific claim strategies.
 * Register custom implementations via
 * {@code META-INF/services/io.campaign.jdbc.retry.AbstractJdbcRetryQueueStore}.
 *
 * @see JdbcRetryQueueStores
 */
public abstract class AbstractJdbcRetryQueueStore implements RetryQueueStore {
  protected static final int PENDING = RetryStatus.PENDING.code();

  protected static final String COLUMNS = "entry_id, campaign_id, schedule_id, occurrence, recipient_id, "
      + "variant, attempt, max_attempts, delay_ms, error_class, last_error_code, last_error_message, "
      + "error_history, next_retry_at, status, created_at, updated_at";

  private final TableNames tables;
  private final JsonCodec jsonCodec;
  private final ErrorHistoryCodec historyCodec;
  private final JdbcTemplate.RowMapper<RetryEntry> rowMapper;

  protected AbstractJdbcRetryQueueStore() {
    this(TableNames.DEFAULTS, JsonCodec.getDefault());
  }

  protected AbstractJdbcRetryQueueStore(TableNames tables, JsonCodec jsonCodec) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.historyCodec = new ErrorHistoryCodec(jsonCodec);
    this.rowMapper = rs -> {
      String variant = rs.getString("variant");
      String errorClass = rs.getString("error_class");
      return new RetryEntry(
          rs.getString("entry_id"),
          rs.getString("campaign_id"),
          rs.getString("schedule_id"),
          rs.getInt("occurrence"),
          rs.getString("recipient_id"),
          variant == null ? null : Variant.valueOf(variant),
          rs.getInt("attempt"),
          rs.getInt("max_attempts"),
          rs.getLong("delay_ms"),
          errorClass == null ? null : ErrorClass.valueOf(errorClass),
          rs.getString("last_error_code"),
          rs.getString("last_error_message"),
          historyCodec.decode(rs.getString("error_history")),
          JdbcTemplate.instant(rs, "next_retry_at"),
          RetryStatus.fromCode(rs.getInt("status")),
          JdbcTemplate.instant(rs, "created_at"),
          JdbcTemplate.instant(rs, "updated_at"));
    };
  }

  /**
   * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same dialect using other table names or codec.
   */
  public abstract AbstractJdbcRetryQueueStore with(TableNames tables, JsonCodec jsonCodec);

  protected String tableName() {
    return tables.retryQueue();
  }

  protected TableNames tables() {
    return tables;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  protected JdbcTemplate.RowMapper<RetryEntry> rowMapper() {
    return rowMapper;
  }

  @Override
  public Optional<RetryEntry> find(Connection conn, String campaignId, String recipientId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE campaign_id=? AND recipient_id=?";
    return JdbcTemplate.queryOne(conn, sql, rowMapper, campaignId, recipientId);
  }

  @Override
  public Optional<RetryEntry> findById(Connection conn, String entryId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE entry_id=?";
    return JdbcTemplate.queryOne(conn, sql, rowMapper, entryId);
  }

  @Override
  public void insert(Connection conn, RetryEntry entry) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", locked_by, locked_at)"
        + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,NULL,NULL)";
    JdbcTemplate.update(conn, sql,
        entry.entryId(), entry.campaignId(), entry.scheduleId(), entry.occurrence(), entry.recipientId(),
        variant(entry), entry.attempt(), entry.maxAttempts(), entry.delayMs(), errorClass(entry),
        entry.lastErrorCode(), entry.lastErrorMessage(), historyCodec.encode(entry.errorHistory()),
        entry.nextRetryAt(), entry.status().code(), entry.createdAt(), entry.updatedAt());
  }

  @Override
  public int update(Connection conn, RetryEntry entry, int expectedAttempt, RetryStatus expectedStatus) {
    String sql = "UPDATE " + tableName() + " SET schedule_id=?, occurrence=?, variant=?, attempt=?,"
        + " max_attempts=?, delay_ms=?, error_class=?, last_error_code=?, last_error_message=?,"
        + " error_history=?, next_retry_at=?, status=?, locked_by=NULL, locked_at=NULL, updated_at=?"
        + " WHERE entry_id=? AND attempt=? AND status=?";
    return JdbcTemplate.update(conn, sql,
        entry.scheduleId(), entry.occurrence(), variant(entry), entry.attempt(), entry.maxAttempts(),
        entry.delayMs(), errorClass(entry), entry.lastErrorCode(), entry.lastErrorMessage(),
        historyCodec.encode(entry.errorHistory()), entry.nextRetryAt(), entry.status().code(),
        entry.updatedAt(), entry.entryId(), expectedAttempt, expectedStatus.code());
  }

  @Override
  public List<RetryEntry> pollDue(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE " + dueCondition() + " ORDER BY next_retry_at, entry_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, now, limit);
  }

  @Override
  public List<RetryEntry> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit) {
    // locked_at doubles as the claim token below, so it must survive the column's precision
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String claimSql = "UPDATE " + tableName() + " SET locked_by=?, locked_at=?"
        + " WHERE entry_id IN (SELECT entry_id FROM " + tableName()
        + " WHERE " + dueCondition() + " AND (locked_by IS NULL OR locked_at < ?)"
        + " ORDER BY next_retry_at, entry_id LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql, ownerId, nowMs, now, lockExpiry, limit);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, ownerId, nowMs);
  }

  /**
   * Entries stamped by {@code ownerId} at exactly {@code lockedAt}, i.e. the batch one claim
   * statement just took.
   */
  protected List<RetryEntry> selectClaimed(Connection conn, String ownerId, Instant lockedAt) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE locked_by=? AND locked_at=? AND status=" + PENDING + " ORDER BY next_retry_at, entry_id";
    return JdbcTemplate.query(conn, sql, rowMapper, ownerId, lockedAt);
  }

  @Override
  public int countPending(Connection conn, String campaignId) {
    String sql = "SELECT COUNT(*) FROM " + tableName() + " WHERE campaign_id=? AND status=" + PENDING;
    return (int) JdbcTemplate.queryLong(conn, sql, campaignId);
  }

  @Override
  public List<RetryEntry> findByStatus(Connection conn, String campaignId, RetryStatus status, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE campaign_id=? AND status=? ORDER BY updated_at, entry_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, rowMapper, campaignId, status.code(), limit);
  }

  /**
   * Pending, due, not exhausted, campaign active or failed. A failed campaign stops
   * scheduling but still finishes the deliveries it already attempted. Binds one parameter: now.
   */
  protected String dueCondition() {
    return "status=" + PENDING + " AND next_retry_at <= ? AND attempt < max_attempts"
        + " AND campaign_id IN (SELECT campaign_id FROM " + tables.campaigns()
        + " WHERE status IN (" + CampaignStatus.ACTIVE.code() + "," + CampaignStatus.FAILED.code() + "))";
  }

  private static String variant(RetryEntry entry) {
    return entry.variant() == null ? null : entry.variant().name();
  }

  private static String errorClass(RetryEntry entry) {
    return entry.errorClass() == null ? null : entry.errorClass().name();
  }
}
