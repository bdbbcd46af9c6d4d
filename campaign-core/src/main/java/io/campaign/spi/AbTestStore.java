package io.campaign.spi;

import io.campaign.model.AbTest;
import io.campaign.model.AbTestOutcome;

import java.sql.Connection;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistence for A/B tests.
 */
public interface AbTestStore {

  void insert(Connection conn, AbTest test);

  Optional<AbTest> find(Connection conn, String testId);

  /** Most recently created test of the campaign, whatever its status. */
  Optional<AbTest> findLatestByCampaign(Connection conn, String campaignId);

  /**
   * Marks an active test completed with its winner.
   */
  int complete(Connection conn, String testId, AbTestOutcome winner, Instant now);
}
