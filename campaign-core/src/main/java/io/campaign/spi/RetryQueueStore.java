package io.campaign.spi;

import io.campaign.model.RetryEntry;
import io.campaign.model.RetryStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for the retry queue. One row per {@code (campaignId, recipientId)}.
 *
 * <p>Implementations must enforce that uniqueness with a constraint so a concurrent
 * duplicate {@link #insert} fails instead of creating a second row.
 */
public interface RetryQueueStore {

  Optional<RetryEntry> find(Connection conn, String campaignId, String recipientId);

  Optional<RetryEntry> findById(Connection conn, String entryId);

  void insert(Connection conn, RetryEntry entry);

  /**
   * Overwrites the mutable columns of an entry if it is still at {@code expectedAttempt}
   * with {@code expectedStatus} (compare-and-set), releasing any claim.
   *
   * @return rows updated; {@code 0} when a concurrent writer changed the entry first
   */
  int update(Connection conn, RetryEntry entry, int expectedAttempt, RetryStatus expectedStatus);

  /**
   * Pending entries with {@code next_retry_at <= now} and {@code attempt < max_attempts},
   * of active or failed campaigns (paused and terminated ones are held), ordered by {@code next_retry_at}.
   */
  List<RetryEntry> pollDue(Connection conn, Instant now, int limit);

  /**
   * Claims due entries for {@code ownerId} so concurrent drainers on other nodes skip them.
   * Entries claimed longer ago than {@code lockExpiry} are claimable again. Must run in a
   * transaction.
   */
  List<RetryEntry> claimDue(Connection conn, String ownerId, Instant now, Instant lockExpiry, int limit);

  int countPending(Connection conn, String campaignId);

  List<RetryEntry> findByStatus(Connection conn, String campaignId, RetryStatus status, int limit);
}
