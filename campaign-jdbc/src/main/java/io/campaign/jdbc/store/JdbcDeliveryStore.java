package io.campaign.jdbc.store;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.Delivery;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.ErrorClass;
import io.campaign.model.Variant;
import io.campaign.spi.DeliveryStore;
import io.campaign.spi.StoreException;

import java.sql.Connection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JDBC delivery store. The {@code (schedule_id, occurrence, recipient_id)} unique key makes
 * {@link #insertIfAbsent} idempotent even when two writers race.
 */
public final class JdbcDeliveryStore implements DeliveryStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String COLUMNS = "delivery_id, campaign_id, schedule_id, occurrence, recipient_id, "
      + "variant, status, error_class, error_code, error_message, retry_entry_id, created_at";

  private static final JdbcTemplate.RowMapper<Delivery> ROW_MAPPER = rs -> {
    String variant = rs.getString("variant");
    String errorClass = rs.getString("error_class");
    return new Delivery(
        rs.getString("delivery_id"),
        rs.getString("campaign_id"),
        rs.getString("schedule_id"),
        rs.getInt("occurrence"),
        rs.getString("recipient_id"),
        variant == null ? null : Variant.valueOf(variant),
        DeliveryStatus.fromCode(rs.getInt("status")),
        errorClass == null ? null : ErrorClass.valueOf(errorClass),
        rs.getString("error_code"),
        rs.getString("error_message"),
        rs.getString("retry_entry_id"),
        JdbcTemplate.instant(rs, "created_at"));
  };

  private final TableNames tables;

  public JdbcDeliveryStore() {
    this(TableNames.DEFAULTS);
  }

  public JdbcDeliveryStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public boolean insertIfAbsent(Connection conn, Delivery delivery) {
    if (exists(conn, delivery.scheduleId(), delivery.occurrence(), delivery.recipientId())) {
      return false;
    }
    String sql = "INSERT INTO " + tables.deliveries() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    try {
      JdbcTemplate.update(conn, sql,
          delivery.deliveryId(), delivery.campaignId(), delivery.scheduleId(), delivery.occurrence(),
          delivery.recipientId(),
          delivery.variant() == null ? null : delivery.variant().name(),
          delivery.status().code(),
          delivery.errorClass() == null ? null : delivery.errorClass().name(),
          delivery.errorCode(), truncate(delivery.errorMessage()), delivery.retryEntryId(),
          delivery.createdAt());
      return true;
    } catch (StoreException e) {
      if (e.isConstraintViolation()) {
        return false;
      }
      throw e;
    }
  }

  @Override
  public boolean exists(Connection conn, String scheduleId, int occurrence, String recipientId) {
    String sql = "SELECT COUNT(*) FROM " + tables.deliveries()
        + " WHERE schedule_id=? AND occurrence=? AND recipient_id=?";
    return JdbcTemplate.queryLong(conn, sql, scheduleId, occurrence, recipientId) > 0;
  }

  @Override
  public Map<DeliveryStatus, Long> countByStatus(Connection conn, String campaignId) {
    String sql = "SELECT status, COUNT(*) AS cnt FROM " + tables.deliveries()
        + " WHERE campaign_id=? GROUP BY status";
    Map<DeliveryStatus, Long> counts = new EnumMap<>(DeliveryStatus.class);
    JdbcTemplate.query(conn, sql, rs -> counts.put(DeliveryStatus.fromCode(rs.getInt("status")), rs.getLong("cnt")),
        campaignId);
    return counts;
  }

  @Override
  public List<Delivery> findByCampaign(Connection conn, String campaignId, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables.deliveries()
        + " WHERE campaign_id=? ORDER BY created_at, delivery_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER, campaignId, limit);
  }

  private static String truncate(String message) {
    if (message == null || message.length() <= MAX_ERROR_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
