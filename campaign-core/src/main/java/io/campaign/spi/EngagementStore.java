package io.campaign.spi;

import io.campaign.model.CampaignRanking;
import io.campaign.model.EngagementEvent;
import io.campaign.model.EngagementType;
import io.campaign.model.Variant;
import io.campaign.model.VariantStats;

import java.sql.Connection;
import java.util.List;
import java.util.Map;

/**
 * Append-only engagement event log and the aggregate queries over it.
 */
public interface EngagementStore {

  void insert(Connection conn, EngagementEvent event);

  Map<EngagementType, Long> countByType(Connection conn, String campaignId);

  /** Distinct recipients with at least one sent delivery of the campaign. */
  long countSentRecipients(Connection conn, String campaignId);

  /**
   * Distinct recipients with a sent delivery and at least one event that
   * {@linkplain EngagementType#isEngagement() counts as engagement}.
   */
  long countEngagedRecipients(Connection conn, String campaignId);

  /**
   * Sent and engaged recipients among those delivered {@code variant}.
   */
  VariantStats variantStats(Connection conn, String campaignId, Variant variant);

  /** Campaigns with sent deliveries, best engaged-over-sent recipient rate first. */
  List<CampaignRanking> topCampaigns(Connection conn, int limit);
}
