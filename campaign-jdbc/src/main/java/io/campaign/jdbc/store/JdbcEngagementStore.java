package io.campaign.jdbc.store;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.CampaignRanking;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.EngagementEvent;
import io.campaign.model.EngagementType;
import io.campaign.model.Variant;
import io.campaign.model.VariantStats;
import io.campaign.spi.EngagementStore;
import io.campaign.util.JsonCodec;

import java.sql.Connection;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * JDBC engagement store. Events are only ever inserted; aggregates join against deliveries.
 */
public final class JdbcEngagementStore implements EngagementStore {
  private static final int SENT = DeliveryStatus.SENT.code();
  private static final String ENGAGEMENT_TYPES = Arrays.stream(EngagementType.values())
      .filter(EngagementType::isEngagement)
      .map(type -> "'" + type.code() + "'")
      .collect(Collectors.joining(","));

  private final TableNames tables;
  private final JsonCodec jsonCodec;

  public JdbcEngagementStore() {
    this(TableNames.DEFAULTS, JsonCodec.getDefault());
  }

  public JdbcEngagementStore(TableNames tables, JsonCodec jsonCodec) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void insert(Connection conn, EngagementEvent event) {
    String sql = "INSERT INTO " + tables.engagementEvents()
        + " (event_id, campaign_id, recipient_id, event_type, metadata, occurred_at) VALUES (?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql, event.eventId(), event.campaignId(), event.recipientId(),
        event.type().code(), jsonCodec.toJson(event.metadata()), event.occurredAt());
  }

  @Override
  public Map<EngagementType, Long> countByType(Connection conn, String campaignId) {
    String sql = "SELECT event_type, COUNT(*) AS cnt FROM " + tables.engagementEvents()
        + " WHERE campaign_id=? GROUP BY event_type";
    Map<EngagementType, Long> counts = new EnumMap<>(EngagementType.class);
    JdbcTemplate.query(conn, sql,
        rs -> counts.put(EngagementType.fromCode(rs.getString("event_type")), rs.getLong("cnt")), campaignId);
    return counts;
  }

  @Override
  public long countSentRecipients(Connection conn, String campaignId) {
    String sql = "SELECT COUNT(DISTINCT recipient_id) FROM " + tables.deliveries()
        + " WHERE campaign_id=? AND status=" + SENT;
    return JdbcTemplate.queryLong(conn, sql, campaignId);
  }

  @Override
  public long countEngagedRecipients(Connection conn, String campaignId) {
    String sql = "SELECT COUNT(DISTINCT e.recipient_id) FROM " + tables.engagementEvents() + " e"
        + " WHERE e.campaign_id=? AND " + engagedCondition("");
    return JdbcTemplate.queryLong(conn, sql, campaignId);
  }

  @Override
  public VariantStats variantStats(Connection conn, String campaignId, Variant variant) {
    String sentSql = "SELECT COUNT(DISTINCT recipient_id) FROM " + tables.deliveries()
        + " WHERE campaign_id=? AND variant=? AND status=" + SENT;
    long sent = JdbcTemplate.queryLong(conn, sentSql, campaignId, variant.name());
    String engagedSql = "SELECT COUNT(DISTINCT e.recipient_id) FROM " + tables.engagementEvents() + " e"
        + " WHERE e.campaign_id=? AND " + engagedCondition(" AND d.variant=?");
    long engaged = JdbcTemplate.queryLong(conn, engagedSql, campaignId, variant.name());
    return new VariantStats(variant, sent, engaged);
  }

  @Override
  public List<CampaignRanking> topCampaigns(Connection conn, int limit) {
    String sql = "SELECT c.campaign_id, c.title, s.sent_count, COALESCE(g.engaged_count, 0) AS engaged_count"
        + " FROM " + tables.campaigns() + " c"
        + " JOIN (SELECT campaign_id, COUNT(DISTINCT recipient_id) AS sent_count FROM " + tables.deliveries()
        + " WHERE status=" + SENT + " GROUP BY campaign_id) s ON s.campaign_id = c.campaign_id"
        + " LEFT JOIN (SELECT e.campaign_id, COUNT(DISTINCT e.recipient_id) AS engaged_count FROM "
        + tables.engagementEvents() + " e WHERE " + engagedCondition("")
        + " GROUP BY e.campaign_id) g ON g.campaign_id = c.campaign_id"
        + " ORDER BY COALESCE(g.engaged_count, 0) * 1.0 / s.sent_count DESC, s.sent_count DESC, c.campaign_id"
        + " LIMIT ?";
    return JdbcTemplate.query(conn, sql, rs -> new CampaignRanking(
        rs.getString("campaign_id"),
        rs.getString("title"),
        rs.getLong("sent_count"),
        rs.getLong("engaged_count")), limit);
  }

  /**
   * Event {@code e} counts as engagement and its recipient was sent the campaign.
   *
   * @param deliveryFilter extra conditions on the matching delivery {@code d}
   */
  private String engagedCondition(String deliveryFilter) {
    return "e.event_type IN (" + ENGAGEMENT_TYPES + ") AND EXISTS (SELECT 1 FROM " + tables.deliveries() + " d"
        + " WHERE d.campaign_id = e.campaign_id AND d.recipient_id = e.recipient_id AND d.status=" + SENT
        + deliveryFilter + ")";
  }
}
