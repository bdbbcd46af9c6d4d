package io.campaign.spi;

import io.campaign.model.RecipientPreferences;
import io.campaign.model.SegmentFilter;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Queryable recipient directory owned by the surrounding product.
 */
public interface RecipientStore {

  /**
   * Returns ids of recipients matching every dimension of the filter, ordered by id, strictly
   * after {@code afterId} (keyset pagination; {@code null} starts from the beginning).
   */
  List<String> findIds(Connection conn, SegmentFilter filter, String afterId, int limit);

  Optional<RecipientPreferences> findPreferences(Connection conn, String recipientId);

  /**
   * Increments the recipient's weekly send counter.
   */
  int incrementWeeklySends(Connection conn, String recipientId, Instant sentAt);

  int updateOptOut(Connection conn, String recipientId, boolean optedOut, String reason, Instant now);
}
