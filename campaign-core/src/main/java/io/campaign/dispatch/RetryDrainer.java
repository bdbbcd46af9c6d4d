package io.campaign.dispatch;

import io.campaign.SendCollaborator;
import io.campaign.SendError;
import io.campaign.frequency.FrequencyGuard;
import io.campaign.model.AbTest;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.RetryEntry;
import io.campaign.model.RetryStatus;
import io.campaign.model.Schedule;
import io.campaign.retry.RetryQueue;
import io.campaign.retry.RetryTarget;
import io.campaign.spi.AbTestStore;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.CampaignStores;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.MetricsExporter;
import io.campaign.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Second poll loop: drains due {@link RetryQueue} entries in {@code next_retry_at} order and
 * re-sends them with the same classification as the first attempt.
 *
 * <p>Success writes a {@code SENT} delivery linked to the entry. A transient failure
 * reschedules the entry, or exhausts it, in which case a {@code FAILED} delivery carrying the
 * final error is written for operator review. Permanent failures end the entry at once.
 * After each pass, {@code DRAINING} schedules whose campaign has no pending retry left are
 * completed.
 *
 * <p>Operates in two modes:
 * <ul>
 *   <li><b>Single-node</b> (default): reads due entries without locking.
 *   <li><b>Multi-node</b>: claims due entries with an owner id and lock timeout so drainers on
 *       several nodes never pick the same entry. Enabled via {@link Builder#claimLocking}.
 * </ul>
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetryDrainer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetryDrainer.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final AbTestStore abTestStore;
  private final RetryQueue retryQueue;
  private final Sender sender;
  private final DeliveryRecorder recorder;
  private final int batchSize;
  private final long intervalMs;
  private final String ownerId;
  private final Duration lockTimeout;
  private final Clock clock;
  private final MetricsExporter metrics;

  private final AtomicBoolean draining = new AtomicBoolean();
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> drainTask;
  private volatile boolean closed;

  private RetryDrainer(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    CampaignStores stores = Objects.requireNonNull(builder.stores, "stores");
    this.retryQueue = Objects.requireNonNull(builder.retryQueue, "retryQueue");
    SendCollaborator sendCollaborator = Objects.requireNonNull(builder.sendCollaborator, "sendCollaborator");
    FrequencyGuard frequencyGuard = Objects.requireNonNull(builder.frequencyGuard, "frequencyGuard");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.campaignStore = stores.campaigns();
    this.abTestStore = stores.abTests();
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.ownerId = builder.ownerId;
    this.lockTimeout = builder.lockTimeout;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    FailureClassifier classifier = builder.failureClassifier != null
        ? builder.failureClassifier : new DefaultFailureClassifier();
    this.sender = new Sender(sendCollaborator, classifier);
    this.recorder = new DeliveryRecorder(stores.deliveries(), frequencyGuard, metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled drain loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RetryDrainer has been closed");
    }
    if (drainTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("campaign-retry-"));
    drainTask = scheduler.scheduleWithFixedDelay(this::drain, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single drain pass. Called automatically by the scheduler, but may also be
   * invoked directly. Returns without doing anything when another pass is in progress.
   */
  public void drain() {
    if (closed) {
      return;
    }
    if (!draining.compareAndSet(false, true)) {
      metrics.incrementTicksSkipped();
      return;
    }
    try {
      List<RetryEntry> due = fetchDue();
      if (due != null) {
        for (RetryEntry entry : due) {
          if (closed) {
            break;
          }
          retry(entry);
        }
      }
      completeDrainedSchedules();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retry drain failed", t);
    } finally {
      draining.set(false);
    }
  }

  /**
   * Returns {@code null} on failure (to distinguish from a successful empty result).
   */
  private List<RetryEntry> fetchDue() {
    try {
      if (ownerId != null) {
        return retryQueue.claimDueEntries(ownerId, lockTimeout, batchSize);
      }
      return retryQueue.dueEntries(batchSize);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch due retry entries", e);
      return null;
    }
  }

  private void retry(RetryEntry entry) {
    try {
      Optional<Campaign> campaign = connectionProvider.withConnection(
          conn -> campaignStore.findCampaign(conn, entry.campaignId()));
      if (campaign.isEmpty()) {
        logger.log(Level.WARNING, "Dropping retry entry {0}: campaign {1} is gone",
            new Object[] {entry.entryId(), entry.campaignId()});
        return;
      }
      RetryTarget target = new RetryTarget(entry.campaignId(), entry.scheduleId(), entry.occurrence(),
          entry.recipientId(), entry.variant());
      SendResult result = sender.send(entry.recipientId(), contentFor(campaign.get(), entry));
      if (result.isSuccess()) {
        // the entry and its SENT delivery change together or not at all
        boolean recorded = connectionProvider.inTransaction(conn -> {
          if (!retryQueue.markSucceeded(conn, entry)) {
            return false;
          }
          recorder.sent(conn, target, entry.entryId(), clock.instant());
          return true;
        });
        if (recorded) {
          completeIfDrained(entry.scheduleId());
        }
        return;
      }
      SendError error = result.error();
      RetryEntry updated = connectionProvider.inTransaction(conn -> {
        RetryEntry next = retryQueue.markFailed(conn, entry, result.errorClass(), error);
        if (next.status() == RetryStatus.FAILED && next.attempt() == entry.attempt() + 1) {
          DeliveryStatus status = result.errorClass().isRetryable()
              ? DeliveryStatus.FAILED : sender.classifier().terminalStatus(error);
          recorder.failed(conn, target, status, result.errorClass(), error, entry.entryId(), clock.instant());
        }
        return next;
      });
      if (updated.status() == RetryStatus.FAILED && updated.attempt() == entry.attempt() + 1) {
        logger.log(Level.WARNING, "Retries exhausted for campaignId={0} recipientId={1} after {2} attempts: {3}",
            new Object[] {entry.campaignId(), entry.recipientId(), updated.attempt(), error.describe()});
        completeIfDrained(entry.scheduleId());
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to process retry entry " + entry.entryId(), e);
    }
  }

  private String contentFor(Campaign campaign, RetryEntry entry) {
    if (entry.variant() == null) {
      return campaign.content();
    }
    return connectionProvider.withConnection(conn -> abTestStore.findLatestByCampaign(conn, campaign.campaignId()))
        .map(test -> test.contentFor(entry.variant()))
        .orElse(campaign.content());
  }

  private void completeDrainedSchedules() {
    List<Schedule> drainingSchedules = connectionProvider.withConnection(
        conn -> campaignStore.findDraining(conn, batchSize));
    for (Schedule schedule : drainingSchedules) {
      completeIfDrained(schedule.scheduleId());
    }
  }

  /**
   * Completes a {@code DRAINING} schedule once its campaign has no pending retry.
   */
  private void completeIfDrained(String scheduleId) {
    Instant now = clock.instant();
    boolean completed = connectionProvider.inTransaction(conn -> {
      Optional<Schedule> schedule = campaignStore.findSchedule(conn, scheduleId);
      if (schedule.isEmpty() || retryQueue.countPending(conn, schedule.get().campaignId()) > 0) {
        return false;
      }
      if (campaignStore.completeDrained(conn, scheduleId, now) == 0) {
        return false;
      }
      campaignStore.updateCampaignStatus(conn, schedule.get().campaignId(),
          EnumSet.of(CampaignStatus.ACTIVE, CampaignStatus.PAUSED), CampaignStatus.COMPLETED, now);
      return true;
    });
    if (completed) {
      metrics.incrementSchedulesCompleted();
      logger.log(Level.INFO, "Schedule {0} completed after its last retry", scheduleId);
    }
  }

  /**
   * Cancels the drain schedule and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (drainTask != null) {
      drainTask.cancel(false);
      drainTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link RetryDrainer}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CampaignStores stores;
    private RetryQueue retryQueue;
    private SendCollaborator sendCollaborator;
    private FrequencyGuard frequencyGuard;
    private FailureClassifier failureClassifier;
    private int batchSize = 100;
    private long intervalMs = 30_000L;
    private String ownerId;
    private Duration lockTimeout;
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
    public Builder stores(CampaignStores stores) {
      this.stores = stores;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder retryQueue(RetryQueue retryQueue) {
      this.retryQueue = retryQueue;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder sendCollaborator(SendCollaborator sendCollaborator) {
      this.sendCollaborator = sendCollaborator;
      return this;
    }

    /**
     * Sets the guard whose weekly counter is incremented by successful retries.
     *
     * <p><b>Required.</b>
     */
    public Builder frequencyGuard(FrequencyGuard frequencyGuard) {
      this.frequencyGuard = frequencyGuard;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link DefaultFailureClassifier}.
     */
    public Builder failureClassifier(FailureClassifier failureClassifier) {
      this.failureClassifier = failureClassifier;
      return this;
    }

    /**
     * Sets the maximum number of entries drained per pass.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 30000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Enables claim-based locking with an auto-generated owner id.
     *
     * @param lockTimeout how long a claimed entry stays locked before another node may claim it
     */
    public Builder claimLocking(Duration lockTimeout) {
      return claimLocking("retry-" + UUID.randomUUID().toString().substring(0, 8), lockTimeout);
    }

    /**
     * Enables claim-based locking for multi-node deployments.
     *
     * @param ownerId     unique identifier for this drainer (e.g. hostname or pod name)
     * @param lockTimeout how long a claimed entry stays locked before another node may claim it
     */
    public Builder claimLocking(String ownerId, Duration lockTimeout) {
      this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      if (lockTimeout.isNegative() || lockTimeout.isZero()) {
        throw new IllegalArgumentException("lockTimeout must be positive");
      }
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

    public RetryDrainer build() {
      return new RetryDrainer(this);
    }
  }
}
