package io.campaign.spi;

import io.campaign.model.Delivery;
import io.campaign.model.DeliveryStatus;

import java.sql.Connection;
import java.util.List;
import java.util.Map;

/**
 * Persistence for per-recipient delivery outcomes.
 */
public interface DeliveryStore {

  /**
   * Inserts the delivery unless one already exists for its
   * {@code (scheduleId, occurrence, recipientId)}.
   *
   * @return {@code true} if a row was inserted
   */
  boolean insertIfAbsent(Connection conn, Delivery delivery);

  boolean exists(Connection conn, String scheduleId, int occurrence, String recipientId);

  Map<DeliveryStatus, Long> countByStatus(Connection conn, String campaignId);

  /** Deliveries of a campaign, oldest first. */
  List<Delivery> findByCampaign(Connection conn, String campaignId, int limit);
}
