package io.campaign.jdbc.store;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.RecurrencePattern;
import io.campaign.model.RecurrenceRule;
import io.campaign.model.Schedule;
import io.campaign.model.ScheduleStatus;
import io.campaign.spi.CampaignStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC campaign and schedule store. Portable across H2, MySQL and PostgreSQL.
 *
 * <p>Multi-column {@code SET} clauses that read a column they also write list the reading
 * assignment first: MySQL evaluates {@code SET} left to right against already-updated values.
 */
public final class JdbcCampaignStore implements CampaignStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final int SCHEDULED = ScheduleStatus.SCHEDULED.code();
  private static final int EXECUTING = ScheduleStatus.EXECUTING.code();
  private static final int PAUSED = ScheduleStatus.PAUSED.code();
  private static final int DRAINING = ScheduleStatus.DRAINING.code();

  private static final String CAMPAIGN_COLUMNS = "campaign_id, title, content, segment_id, recurrence_pattern, "
      + "cron_expression, end_at, max_occurrences, status, created_at, updated_at";
  private static final String SCHEDULE_COLUMNS = "schedule_id, campaign_id, scheduled_for, status, "
      + "execution_order, execution_count, pause_requested, locked_by, locked_at, last_executed_at, "
      + "last_error, updated_at";

  private static final JdbcTemplate.RowMapper<Campaign> CAMPAIGN_ROW_MAPPER = rs -> new Campaign(
      rs.getString("campaign_id"),
      rs.getString("title"),
      rs.getString("content"),
      rs.getString("segment_id"),
      new RecurrenceRule(
          RecurrencePattern.fromCode(rs.getString("recurrence_pattern")),
          rs.getString("cron_expression"),
          JdbcTemplate.instant(rs, "end_at"),
          JdbcTemplate.nullableInt(rs, "max_occurrences")),
      CampaignStatus.fromCode(rs.getInt("status")),
      JdbcTemplate.instant(rs, "created_at"),
      JdbcTemplate.instant(rs, "updated_at"));

  private static final JdbcTemplate.RowMapper<Schedule> SCHEDULE_ROW_MAPPER = rs -> new Schedule(
      rs.getString("schedule_id"),
      rs.getString("campaign_id"),
      JdbcTemplate.instant(rs, "scheduled_for"),
      ScheduleStatus.fromCode(rs.getInt("status")),
      rs.getInt("execution_order"),
      rs.getInt("execution_count"),
      rs.getBoolean("pause_requested"),
      rs.getString("locked_by"),
      JdbcTemplate.instant(rs, "locked_at"),
      JdbcTemplate.instant(rs, "last_executed_at"),
      rs.getString("last_error"),
      JdbcTemplate.instant(rs, "updated_at"));

  private final TableNames tables;

  public JdbcCampaignStore() {
    this(TableNames.DEFAULTS);
  }

  public JdbcCampaignStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public void insertCampaign(Connection conn, Campaign campaign) {
    RecurrenceRule rule = campaign.recurrence();
    String sql = "INSERT INTO " + tables.campaigns() + " (" + CAMPAIGN_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        campaign.campaignId(), campaign.title(), campaign.content(), campaign.segmentId(),
        rule.pattern().code(), rule.cronExpression(), rule.endAt(), rule.maxOccurrences(),
        campaign.status().code(), campaign.createdAt(), campaign.updatedAt());
  }

  @Override
  public Optional<Campaign> findCampaign(Connection conn, String campaignId) {
    String sql = "SELECT " + CAMPAIGN_COLUMNS + " FROM " + tables.campaigns() + " WHERE campaign_id=?";
    return JdbcTemplate.queryOne(conn, sql, CAMPAIGN_ROW_MAPPER, campaignId);
  }

  @Override
  public int updateCampaignStatus(Connection conn, String campaignId, Set<CampaignStatus> expected,
      CampaignStatus newStatus, Instant now) {
    if (expected.isEmpty()) {
      return 0;
    }
    String sql = "UPDATE " + tables.campaigns() + " SET status=?, updated_at=?"
        + " WHERE campaign_id=? AND status IN " + codes(expected);
    return JdbcTemplate.update(conn, sql, newStatus.code(), now, campaignId);
  }

  @Override
  public void insertSchedule(Connection conn, Schedule schedule) {
    String sql = "INSERT INTO " + tables.schedules() + " (" + SCHEDULE_COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        schedule.scheduleId(), schedule.campaignId(), schedule.scheduledFor(), schedule.status().code(),
        schedule.executionOrder(), schedule.executionCount(), schedule.pauseRequested(),
        schedule.lockedBy(), schedule.lockedAt(), schedule.lastExecutedAt(),
        truncateError(schedule.lastError()), schedule.updatedAt());
  }

  @Override
  public Optional<Schedule> findSchedule(Connection conn, String scheduleId) {
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM " + tables.schedules() + " WHERE schedule_id=?";
    return JdbcTemplate.queryOne(conn, sql, SCHEDULE_ROW_MAPPER, scheduleId);
  }

  @Override
  public Optional<Schedule> findScheduleByCampaign(Connection conn, String campaignId) {
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM " + tables.schedules() + " WHERE campaign_id=?";
    return JdbcTemplate.queryOne(conn, sql, SCHEDULE_ROW_MAPPER, campaignId);
  }

  @Override
  public List<Schedule> pollDue(Connection conn, Instant now, Instant lockExpiry, int limit) {
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM " + tables.schedules()
        + " WHERE " + activeCampaign() + " AND " + claimable()
        + " ORDER BY execution_order, scheduled_for LIMIT ?";
    return JdbcTemplate.query(conn, sql, SCHEDULE_ROW_MAPPER, now, lockExpiry, limit);
  }

  @Override
  public int claim(Connection conn, String scheduleId, String ownerId, Instant now, Instant lockExpiry) {
    // A takeover of an expired claim re-runs the same occurrence, so the count only moves on a fresh start
    String sql = "UPDATE " + tables.schedules() + " SET"
        + " execution_count = CASE WHEN status=" + SCHEDULED + " THEN execution_count+1 ELSE execution_count END,"
        + " status=" + EXECUTING + ", locked_by=?, locked_at=?, last_executed_at=?, updated_at=?"
        + " WHERE schedule_id=? AND " + activeCampaign() + " AND " + claimable();
    return JdbcTemplate.update(conn, sql, ownerId, now, now, now, scheduleId, now, lockExpiry);
  }

  @Override
  public int reschedule(Connection conn, String scheduleId, String ownerId, Instant nextAt, Instant now) {
    String sql = "UPDATE " + tables.schedules() + " SET"
        + " status = CASE WHEN pause_requested THEN " + PAUSED + " ELSE " + SCHEDULED + " END,"
        + " pause_requested=FALSE, scheduled_for=?, locked_by=NULL, locked_at=NULL, last_error=NULL, updated_at=?"
        + " WHERE schedule_id=? AND status=" + EXECUTING + " AND locked_by=?";
    return JdbcTemplate.update(conn, sql, nextAt, now, scheduleId, ownerId);
  }

  @Override
  public int finish(Connection conn, String scheduleId, String ownerId, ScheduleStatus status,
      String error, Instant now) {
    String sql = "UPDATE " + tables.schedules() + " SET status=?, last_error=?, locked_by=NULL, locked_at=NULL,"
        + " updated_at=? WHERE schedule_id=? AND status=" + EXECUTING + " AND locked_by=?";
    return JdbcTemplate.update(conn, sql, status.code(), truncateError(error), now, scheduleId, ownerId);
  }

  @Override
  public int pause(Connection conn, String scheduleId, Instant now) {
    String sql = "UPDATE " + tables.schedules() + " SET"
        + " pause_requested = CASE WHEN status=" + SCHEDULED + " THEN FALSE ELSE TRUE END,"
        + " status = CASE WHEN status=" + SCHEDULED + " THEN " + PAUSED + " ELSE status END,"
        + " updated_at=?"
        + " WHERE schedule_id=? AND status IN (" + SCHEDULED + "," + EXECUTING + "," + DRAINING + ")";
    return JdbcTemplate.update(conn, sql, now, scheduleId);
  }

  @Override
  public int resume(Connection conn, String scheduleId, Instant now) {
    String sql = "UPDATE " + tables.schedules() + " SET"
        + " status = CASE WHEN status=" + PAUSED + " THEN " + SCHEDULED + " ELSE status END,"
        + " pause_requested=FALSE, updated_at=?"
        + " WHERE schedule_id=? AND status IN (" + PAUSED + "," + EXECUTING + "," + DRAINING + ")";
    return JdbcTemplate.update(conn, sql, now, scheduleId);
  }

  @Override
  public int completeDrained(Connection conn, String scheduleId, Instant now) {
    String sql = "UPDATE " + tables.schedules() + " SET status=" + ScheduleStatus.COMPLETED.code()
        + ", pause_requested=FALSE, updated_at=? WHERE schedule_id=? AND status=" + DRAINING;
    return JdbcTemplate.update(conn, sql, now, scheduleId);
  }

  @Override
  public int terminate(Connection conn, String scheduleId, String reason, Instant now) {
    String sql = "UPDATE " + tables.schedules() + " SET status=" + ScheduleStatus.FAILED.code()
        + ", last_error=?, pause_requested=FALSE, locked_by=NULL, locked_at=NULL, updated_at=?"
        + " WHERE schedule_id=? AND status IN (" + SCHEDULED + "," + EXECUTING + "," + PAUSED + "," + DRAINING + ")";
    return JdbcTemplate.update(conn, sql, truncateError(reason), now, scheduleId);
  }

  @Override
  public List<Schedule> findDraining(Connection conn, int limit) {
    String sql = "SELECT " + SCHEDULE_COLUMNS + " FROM " + tables.schedules()
        + " WHERE status=" + DRAINING + " ORDER BY updated_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, SCHEDULE_ROW_MAPPER, limit);
  }

  private String activeCampaign() {
    return "campaign_id IN (SELECT campaign_id FROM " + tables.campaigns()
        + " WHERE status=" + CampaignStatus.ACTIVE.code() + ")";
  }

  /** Binds two parameters: now, lock expiry. */
  private static String claimable() {
    return "((status=" + SCHEDULED + " AND scheduled_for <= ?) OR (status=" + EXECUTING + " AND locked_at < ?))";
  }

  private static String codes(Set<CampaignStatus> statuses) {
    return statuses.stream()
        .map(s -> Integer.toString(s.code()))
        .collect(Collectors.joining(",", "(", ")"));
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
