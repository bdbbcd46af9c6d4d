package io.campaign.analytics;

import io.campaign.model.CampaignAnalytics;
import io.campaign.model.CampaignRanking;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.EngagementEvent;
import io.campaign.model.EngagementType;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.DeliveryStore;
import io.campaign.spi.EngagementStore;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Records post-delivery engagement and aggregates it per campaign.
 *
 * <p>Events are append-only; recording never touches earlier events.
 */
public final class EngagementTracker {
  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final EngagementStore engagementStore;
  private final Clock clock;

  public EngagementTracker(ConnectionProvider connectionProvider, DeliveryStore deliveryStore,
      EngagementStore engagementStore) {
    this(connectionProvider, deliveryStore, engagementStore, Clock.systemUTC());
  }

  public EngagementTracker(ConnectionProvider connectionProvider, DeliveryStore deliveryStore,
      EngagementStore engagementStore, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.engagementStore = Objects.requireNonNull(engagementStore, "engagementStore");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Appends one engagement event.
   *
   * @param metadata optional free-form attributes, may be {@code null}
   * @return the stored event
   */
  public EngagementEvent recordEvent(String campaignId, String recipientId, EngagementType type,
      Map<String, String> metadata) {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(recipientId, "recipientId");
    Objects.requireNonNull(type, "type");
    EngagementEvent event = new EngagementEvent(UUID.randomUUID().toString(), campaignId, recipientId,
        type, metadata, clock.instant().truncatedTo(ChronoUnit.MILLIS));
    connectionProvider.withConnection(conn -> {
      engagementStore.insert(conn, event);
      return null;
    });
    return event;
  }

  /**
   * Delivery and engagement counts of a campaign. The engagement rate is engaged recipients
   * over recipients sent to, so a recurring campaign's repeat sends do not dilute it.
   */
  public CampaignAnalytics analytics(String campaignId) {
    Objects.requireNonNull(campaignId, "campaignId");
    return connectionProvider.withConnection(conn -> {
      Map<DeliveryStatus, Long> deliveries = deliveryStore.countByStatus(conn, campaignId);
      Map<EngagementType, Long> events = engagementStore.countByType(conn, campaignId);
      long sentRecipients = engagementStore.countSentRecipients(conn, campaignId);
      long engaged = engagementStore.countEngagedRecipients(conn, campaignId);
      return new CampaignAnalytics(campaignId,
          deliveries.getOrDefault(DeliveryStatus.SENT, 0L),
          deliveries.getOrDefault(DeliveryStatus.FAILED, 0L),
          deliveries.getOrDefault(DeliveryStatus.BLOCKED, 0L),
          events.getOrDefault(EngagementType.OPENED, 0L),
          events.getOrDefault(EngagementType.CLICKED, 0L),
          events.getOrDefault(EngagementType.REPLIED, 0L),
          events.getOrDefault(EngagementType.SHARED, 0L),
          sentRecipients,
          engaged);
    });
  }

  /**
   * Campaigns with at least one sent delivery, best engagement rate first.
   */
  public List<CampaignRanking> topCampaigns(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return connectionProvider.withConnection(conn -> engagementStore.topCampaigns(conn, limit));
  }
}
