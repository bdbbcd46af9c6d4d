package io.campaign.frequency;

import io.campaign.model.RecipientPreferences;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.RecipientStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-recipient opt-out and weekly frequency cap.
 *
 * <p>A recipient is eligible when it is not opted out and its {@code sendsThisWeek} is below
 * its cap (its own {@code maxSendsPerWeek}, else the configured default). Unknown recipients
 * are eligible. The guard only reads counters and increments them on a send; resetting the
 * weekly counter belongs to an external periodic job.
 */
public final class FrequencyGuard {
  private static final Logger logger = Logger.getLogger(FrequencyGuard.class.getName());

  /** Default weekly cap when the recipient has none of its own. */
  public static final int DEFAULT_WEEKLY_CAP = 7;

  private final ConnectionProvider connectionProvider;
  private final RecipientStore recipientStore;
  private final int defaultWeeklyCap;

  public FrequencyGuard(ConnectionProvider connectionProvider, RecipientStore recipientStore) {
    this(connectionProvider, recipientStore, DEFAULT_WEEKLY_CAP);
  }

  public FrequencyGuard(ConnectionProvider connectionProvider, RecipientStore recipientStore, int defaultWeeklyCap) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.recipientStore = Objects.requireNonNull(recipientStore, "recipientStore");
    if (defaultWeeklyCap <= 0) {
      throw new IllegalArgumentException("defaultWeeklyCap must be > 0, got: " + defaultWeeklyCap);
    }
    this.defaultWeeklyCap = defaultWeeklyCap;
  }

  /**
   * Evaluates stored preferences against a default cap.
   *
   * @param preferences the recipient's preferences, or {@code null} if unknown
   */
  public static Eligibility evaluate(RecipientPreferences preferences, int defaultWeeklyCap) {
    if (preferences == null) {
      return Eligibility.ELIGIBLE;
    }
    if (preferences.optedOut()) {
      return Eligibility.OPTED_OUT;
    }
    int cap = preferences.maxSendsPerWeek() != null ? preferences.maxSendsPerWeek() : defaultWeeklyCap;
    if (preferences.sendsThisWeek() >= cap) {
      return Eligibility.FREQUENCY_CAPPED;
    }
    return Eligibility.ELIGIBLE;
  }

  public Eligibility check(String recipientId) {
    return connectionProvider.withConnection(conn -> check(conn, recipientId));
  }

  public Eligibility check(Connection conn, String recipientId) {
    Optional<RecipientPreferences> preferences = recipientStore.findPreferences(conn, recipientId);
    return evaluate(preferences.orElse(null), defaultWeeklyCap);
  }

  /**
   * Counts a successful send against the recipient's weekly cap.
   */
  public void recordSend(Connection conn, String recipientId, Instant sentAt) {
    if (recipientStore.incrementWeeklySends(conn, recipientId, sentAt) == 0) {
      logger.log(Level.FINE, "No recipient row to count send for recipientId={0}", recipientId);
    }
  }

  /**
   * Sets or clears the recipient's opt-out flag.
   *
   * @return {@code true} if the recipient exists
   */
  public boolean setOptOut(String recipientId, boolean optedOut, String reason, Instant now) {
    Objects.requireNonNull(recipientId, "recipientId");
    return connectionProvider.withConnection(
        conn -> recipientStore.updateOptOut(conn, recipientId, optedOut, reason, now) > 0);
  }
}
