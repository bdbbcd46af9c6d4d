package io.campaign.retry;

import io.campaign.SendError;
import io.campaign.model.ErrorClass;
import io.campaign.model.ErrorRecord;
import io.campaign.model.RetryEntry;
import io.campaign.model.RetryStatus;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.MetricsExporter;
import io.campaign.spi.RetryQueueStore;
import io.campaign.spi.StoreException;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable queue of sends waiting to be retried, one entry per {@code (campaign, recipient)}.
 *
 * <h2>Attempt accounting</h2>
 * <p>An entry's {@code attempt} is the number of failures recorded for it. The failure that
 * creates the entry is attempt 1; each further failure increments it and appends to the
 * error history. The delay before the next retry is
 * {@code max(backoffPolicy.computeDelayMs(errorClass, attempt), retryAfterHint)}, with the hint
 * capped at {@link #MAX_RETRY_AFTER}. When the
 * new attempt reaches {@code maxAttempts}, or the failure is permanent, the entry turns
 * {@code FAILED} instead of being rescheduled.
 *
 * <h2>Concurrency</h2>
 * <p>Every write is a compare-and-set on {@code (attempt, status)}. A duplicate insert
 * racing on the {@code (campaign, recipient)} key, or a lost compare-and-set, re-reads the
 * row and applies the change on top of it, so concurrent enqueues never produce two rows.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetryQueue {
  private static final Logger logger = Logger.getLogger(RetryQueue.class.getName());
  private static final int MAX_WRITE_ATTEMPTS = 5;
  private static final int MAX_MESSAGE_LENGTH = 1000;

  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  /** Longest wait a provider's retry-after hint can impose. */
  public static final Duration MAX_RETRY_AFTER = Duration.ofDays(30);

  private final ConnectionProvider connectionProvider;
  private final RetryQueueStore store;
  private final BackoffPolicy backoffPolicy;
  private final int maxAttempts;
  private final Clock clock;
  private final MetricsExporter metrics;

  private RetryQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(builder.store, "store");
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.backoffPolicy = builder.backoffPolicy != null ? builder.backoffPolicy : GeometricBackoffPolicy.defaults();
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Records a failed send for retry. Creates the entry on the first failure for the pair;
   * otherwise increments its attempt. A pair whose previous entry already ended
   * ({@code SUCCEEDED} or {@code FAILED}) starts over at attempt 1, keeping its history.
   *
   * @return the entry as written; {@code FAILED} when no retry will follow
   */
  public RetryEntry enqueue(RetryTarget target, ErrorClass errorClass, SendError error) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(errorClass, "errorClass");
    Objects.requireNonNull(error, "error");
    return connectionProvider.withConnection(conn -> enqueue(conn, target, errorClass, error));
  }

  private RetryEntry enqueue(Connection conn, RetryTarget target, ErrorClass errorClass, SendError error) {
    for (int i = 0; i < MAX_WRITE_ATTEMPTS; i++) {
      Instant now = now();
      Optional<RetryEntry> existing = store.find(conn, target.campaignId(), target.recipientId());
      if (existing.isEmpty()) {
        RetryEntry created = failure(newEntry(target, now), 1, errorClass, error, now);
        try {
          store.insert(conn, created);
          recordEnqueued(created);
          return created;
        } catch (StoreException e) {
          if (!e.isConstraintViolation()) {
            throw e;
          }
          // a concurrent enqueue created the row; apply this failure on top of it
          continue;
        }
      }
      RetryEntry current = existing.get();
      RetryEntry next = current.isPending()
          ? failure(current, current.attempt() + 1, errorClass, error, now)
          : failure(restart(current, target, now), 1, errorClass, error, now);
      if (store.update(conn, next, current.attempt(), current.status()) == 1) {
        recordEnqueued(next);
        return next;
      }
    }
    throw new IllegalStateException("Retry entry for campaignId=" + target.campaignId()
        + " recipientId=" + target.recipientId() + " kept changing concurrently");
  }

  /**
   * Pending entries due at the current time, oldest {@code next_retry_at} first.
   */
  public List<RetryEntry> dueEntries(int limit) {
    return connectionProvider.withConnection(conn -> store.pollDue(conn, now(), limit));
  }

  /**
   * Claims due entries for {@code ownerId} so that drainers on other nodes skip them until
   * {@code lockTimeout} elapses.
   */
  public List<RetryEntry> claimDueEntries(String ownerId, Duration lockTimeout, int limit) {
    Instant now = now();
    return connectionProvider.inTransaction(
        conn -> store.claimDue(conn, ownerId, now, now.minus(lockTimeout), limit));
  }

  /**
   * Marks a pending entry as delivered.
   *
   * @return {@code false} if the entry was no longer pending at the expected attempt
   */
  public boolean markSucceeded(RetryEntry entry) {
    return connectionProvider.withConnection(conn -> markSucceeded(conn, entry));
  }

  /**
   * Marks a pending entry as delivered on the caller's connection, so the caller can record
   * the delivery in the same transaction.
   */
  public boolean markSucceeded(Connection conn, RetryEntry entry) {
    RetryEntry succeeded = copy(entry, entry.attempt(), entry.delayMs(), entry.errorClass(),
        entry.lastErrorCode(), entry.lastErrorMessage(), entry.errorHistory(), entry.nextRetryAt(),
        RetryStatus.SUCCEEDED, now());
    boolean updated = store.update(conn, succeeded, entry.attempt(), RetryStatus.PENDING) == 1;
    if (updated) {
      metrics.incrementRetriesSucceeded();
    }
    return updated;
  }

  /**
   * Records another failure of a pending entry: reschedules it, or finalizes it as
   * {@code FAILED} when attempts are exhausted or the failure is permanent.
   *
   * @return the entry as written, or the current row if a concurrent writer got there first
   */
  public RetryEntry markFailed(RetryEntry entry, ErrorClass errorClass, SendError error) {
    return connectionProvider.withConnection(conn -> markFailed(conn, entry, errorClass, error));
  }

  /** {@link #markFailed(RetryEntry, ErrorClass, SendError)} on the caller's connection. */
  public RetryEntry markFailed(Connection conn, RetryEntry entry, ErrorClass errorClass, SendError error) {
    Objects.requireNonNull(errorClass, "errorClass");
    Objects.requireNonNull(error, "error");
    RetryEntry next = failure(entry, entry.attempt() + 1, errorClass, error, now());
    if (store.update(conn, next, entry.attempt(), RetryStatus.PENDING) == 1) {
      if (next.status() == RetryStatus.FAILED) {
        metrics.incrementRetriesExhausted();
      }
      return next;
    }
    logger.log(Level.FINE, "Retry entry {0} changed concurrently; keeping stored state", entry.entryId());
    return store.findById(conn, entry.entryId()).orElse(next);
  }

  public boolean hasPending(Connection conn, String campaignId, String recipientId) {
    return store.find(conn, campaignId, recipientId).filter(RetryEntry::isPending).isPresent();
  }

  public int countPending(Connection conn, String campaignId) {
    return store.countPending(conn, campaignId);
  }

  /**
   * Entries that ran out of attempts, for operator review.
   */
  public List<RetryEntry> exhaustedEntries(String campaignId, int limit) {
    return connectionProvider.withConnection(
        conn -> store.findByStatus(conn, campaignId, RetryStatus.FAILED, limit));
  }

  /**
   * Applies one failure to {@code base}: bumps the attempt, appends history and either
   * schedules the next retry or finalizes the entry.
   */
  private RetryEntry failure(RetryEntry base, int attempt, ErrorClass errorClass, SendError error, Instant now) {
    List<ErrorRecord> history = new ArrayList<>(base.errorHistory());
    String message = truncate(error.message());
    history.add(new ErrorRecord(now, attempt, error.code(), message));
    boolean terminal = !errorClass.isRetryable() || attempt >= base.maxAttempts();
    long delayMs = terminal ? base.delayMs() : delayFor(errorClass, attempt, error);
    Instant nextRetryAt = terminal ? base.nextRetryAt() : now.plusMillis(delayMs);
    RetryStatus status = terminal ? RetryStatus.FAILED : RetryStatus.PENDING;
    return copy(base, attempt, delayMs, errorClass, error.code(), message, history, nextRetryAt, status, now);
  }

  /**
   * Backoff delay, floored by the provider's retry-after hint when present.
   */
  long delayFor(ErrorClass errorClass, int attempt, SendError error) {
    long formulaMs = backoffPolicy.computeDelayMs(errorClass, attempt);
    if (error.retryAfterSeconds() == null) {
      return formulaMs;
    }
    long hintSeconds = Math.min(error.retryAfterSeconds(), MAX_RETRY_AFTER.getSeconds());
    return Math.max(formulaMs, TimeUnit.SECONDS.toMillis(hintSeconds));
  }

  private RetryEntry newEntry(RetryTarget target, Instant now) {
    return new RetryEntry(UUID.randomUUID().toString(), target.campaignId(), target.scheduleId(),
        target.occurrence(), target.recipientId(), target.variant(), 0, maxAttempts, 0L, null,
        null, null, List.of(), now, RetryStatus.PENDING, now, now);
  }

  private RetryEntry restart(RetryEntry previous, RetryTarget target, Instant now) {
    return new RetryEntry(previous.entryId(), target.campaignId(), target.scheduleId(),
        target.occurrence(), target.recipientId(), target.variant(), 0, maxAttempts, 0L, null,
        null, null, previous.errorHistory(), now, RetryStatus.PENDING, previous.createdAt(), now);
  }

  private static RetryEntry copy(RetryEntry base, int attempt, long delayMs, ErrorClass errorClass,
      String code, String message, List<ErrorRecord> history, Instant nextRetryAt, RetryStatus status,
      Instant now) {
    return new RetryEntry(base.entryId(), base.campaignId(), base.scheduleId(), base.occurrence(),
        base.recipientId(), base.variant(), attempt, base.maxAttempts(), delayMs, errorClass, code,
        message, history, nextRetryAt, status, base.createdAt(), now);
  }

  private void recordEnqueued(RetryEntry entry) {
    if (entry.status() == RetryStatus.FAILED) {
      metrics.incrementRetriesExhausted();
    } else {
      metrics.incrementRetriesEnqueued();
    }
  }

  private Instant now() {
    // Stored timestamps are millisecond precision on every supported database
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  private static String truncate(String message) {
    if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
  }

  /**
   * Builder for {@link RetryQueue}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private RetryQueueStore store;
    private BackoffPolicy backoffPolicy;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder store(RetryQueueStore store) {
      this.store = store;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link GeometricBackoffPolicy#defaults()}.
     */
    public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
      this.backoffPolicy = backoffPolicy;
      return this;
    }

    /**
     * Sets how many failures a new entry may record before it is finalized.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public RetryQueue build() {
      return new RetryQueue(this);
    }
  }
}
