package io.campaign.dispatch;

import io.campaign.SendCollaborator;
import io.campaign.frequency.FrequencyGuard;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.RecurrenceRule;
import io.campaign.model.Schedule;
import io.campaign.model.ScheduleStatus;
import io.campaign.recurrence.RecurrencePlan;
import io.campaign.recurrence.RecurrencePlanner;
import io.campaign.retry.RetryQueue;
import io.campaign.segment.SegmentResolver;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.CampaignStores;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.MetricsExporter;
import io.campaign.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
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
 * Poll loop that finds due schedules, claims them and executes them.
 *
 * <h2>Tick</h2>
 * <ol>
 *   <li>Select up to {@code batchSize} claimable schedules of active campaigns, ordered by
 *       execution order.</li>
 *   <li>For each: reserve it in the {@link InFlightTracker}, then claim it with a conditional
 *       update ({@code SCHEDULED -> EXECUTING}). Losing the claim means another tick or node
 *       owns it, and the schedule is skipped.</li>
 *   <li>Fan out to recipients, then move the schedule on: recurring campaigns are rescheduled
 *       at the next planned time (or {@code PAUSED} if a pause arrived meanwhile); finished
 *       ones become {@code COMPLETED}, or {@code DRAINING} while retries are still pending.
 *       A malformed cron expression fails the schedule and its campaign.</li>
 * </ol>
 * A tick that starts while the previous one is still running is discarded, not queued.
 * {@link #tick()} can be called directly, which together with an injected {@link Clock} is how
 * tests drive the loop.
 *
 * <h2>Recovery</h2>
 * <p>An {@code EXECUTING} schedule whose claim is older than {@code lockTimeout} (its owner
 * died or lost the database mid-execution) is claimable again. Re-execution skips recipients
 * already delivered for that occurrence.
 *
 * <p>Create instances via {@link #builder()}. The {@link #start()} and {@link #close()}
 * methods are synchronized to prevent concurrent lifecycle transitions.
 */
public final class ScheduleDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ScheduleDispatcher.class.getName());
  private static final int MAX_SKIPPED_OCCURRENCES = 10_000;

  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final RetryQueue retryQueue;
  private final RecurrencePlanner planner;
  private final InFlightTracker inFlightTracker;
  private final ScheduleExecutor executor;
  private final int batchSize;
  private final long intervalMs;
  private final Duration lockTimeout;
  private final String ownerId;
  private final Clock clock;
  private final MetricsExporter metrics;

  private final AtomicBoolean ticking = new AtomicBoolean();
  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private ScheduleDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    CampaignStores stores = Objects.requireNonNull(builder.stores, "stores");
    SendCollaborator sendCollaborator = Objects.requireNonNull(builder.sendCollaborator, "sendCollaborator");
    this.retryQueue = Objects.requireNonNull(builder.retryQueue, "retryQueue");
    SegmentResolver segmentResolver = Objects.requireNonNull(builder.segmentResolver, "segmentResolver");
    FrequencyGuard frequencyGuard = Objects.requireNonNull(builder.frequencyGuard, "frequencyGuard");

    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.lockTimeout == null || builder.lockTimeout.isNegative() || builder.lockTimeout.isZero()) {
      throw new IllegalArgumentException("lockTimeout must be positive");
    }

    this.campaignStore = stores.campaigns();
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.lockTimeout = builder.lockTimeout;
    this.ownerId = builder.ownerId != null ? builder.ownerId
        : "dispatcher-" + UUID.randomUUID().toString().substring(0, 8);
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.planner = builder.planner != null ? builder.planner : new RecurrencePlanner();
    this.inFlightTracker = builder.inFlightTracker != null ? builder.inFlightTracker
        : new DefaultInFlightTracker(lockTimeout, clock);
    FailureClassifier classifier = builder.failureClassifier != null
        ? builder.failureClassifier : new DefaultFailureClassifier();
    this.executor = new ScheduleExecutor(connectionProvider, stores.deliveries(), stores.abTests(),
        segmentResolver, frequencyGuard, retryQueue, new Sender(sendCollaborator, classifier), clock, metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String ownerId() {
    return ownerId;
  }

  /**
   * Starts the scheduled tick loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ScheduleDispatcher has been closed");
    }
    if (tickTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("campaign-dispatcher-"));
    tickTask = scheduler.scheduleWithFixedDelay(this::tick, 0L, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single tick. Called automatically by the scheduler, but may also be invoked
   * directly. Returns without doing anything when another tick is in progress.
   */
  public void tick() {
    if (closed) {
      return;
    }
    if (!ticking.compareAndSet(false, true)) {
      metrics.incrementTicksSkipped();
      logger.log(Level.FINE, "Previous tick still running; skipping");
      return;
    }
    try {
      if (inFlightTracker instanceof DefaultInFlightTracker tracker) {
        tracker.evictExpired();
      }
      Instant now = now();
      List<Schedule> due = fetchDue(now);
      if (due == null) {
        return; // fetch failed; leave the lag metric as it was
      }
      if (due.isEmpty()) {
        metrics.recordScheduleLagMs(0);
        return;
      }
      Instant oldest = due.stream().map(Schedule::scheduledFor).min(Instant::compareTo).orElse(now);
      metrics.recordScheduleLagMs(Math.max(0L, Duration.between(oldest, now).toMillis()));
      for (Schedule schedule : due) {
        if (closed) {
          break;
        }
        run(schedule, now);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Dispatcher tick failed", t);
    } finally {
      ticking.set(false);
    }
  }

  /**
   * Fetches claimable schedules. Returns {@code null} on failure (to distinguish from a
   * successful empty result).
   */
  private List<Schedule> fetchDue(Instant now) {
    try {
      return connectionProvider.withConnection(
          conn -> campaignStore.pollDue(conn, now, now.minus(lockTimeout), batchSize));
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to fetch due schedules", e);
      return null;
    }
  }

  private void run(Schedule due, Instant now) {
    String scheduleId = due.scheduleId();
    if (!inFlightTracker.tryAcquire(scheduleId)) {
      return;
    }
    try {
      Optional<Schedule> claimed = claim(scheduleId, now);
      if (claimed.isEmpty()) {
        logger.log(Level.FINE, "Schedule {0} was claimed elsewhere", scheduleId);
        return;
      }
      metrics.incrementSchedulesClaimed();
      Schedule schedule = claimed.get();
      Campaign campaign = connectionProvider.withConnection(
          conn -> campaignStore.findCampaign(conn, schedule.campaignId()))
          .orElseThrow(() -> new IllegalStateException("Campaign " + schedule.campaignId() + " not found"));
      try {
        executor.execute(schedule, campaign);
      } catch (UndeliverableCampaignException e) {
        logger.log(Level.WARNING, "Campaign " + campaign.campaignId() + " cannot be delivered", e);
        fail(schedule, e.getMessage());
        return;
      }
      advance(schedule, campaign);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Execution of schedule " + scheduleId
          + " failed; it becomes claimable again after " + lockTimeout, e);
    } finally {
      inFlightTracker.release(scheduleId);
    }
  }

  private Optional<Schedule> claim(String scheduleId, Instant now) {
    return connectionProvider.withConnection(conn -> {
      if (campaignStore.claim(conn, scheduleId, ownerId, now, now.minus(lockTimeout)) != 1) {
        return Optional.<Schedule>empty();
      }
      return campaignStore.findSchedule(conn, scheduleId);
    });
  }

  /**
   * Moves an executed schedule to its next state.
   */
  private void advance(Schedule schedule, Campaign campaign) {
    RecurrenceRule rule = campaign.recurrence();
    Instant now = now();
    if (rule.isRecurring()) {
      RecurrencePlan plan = planAfter(rule, schedule, now);
      if (plan instanceof RecurrencePlan.Next next) {
        int updated = connectionProvider.withConnection(
            conn -> campaignStore.reschedule(conn, schedule.scheduleId(), ownerId, next.at(), now));
        if (updated == 0) {
          logger.log(Level.WARNING, "Lost ownership of schedule {0} before rescheduling", schedule.scheduleId());
        }
        return;
      }
      RecurrencePlan.Done done = (RecurrencePlan.Done) plan;
      if (done.reason() == RecurrencePlan.DoneReason.INVALID_EXPRESSION) {
        logger.log(Level.WARNING, "Invalid recurrence expression ''{0}'' for campaign {1}; stopping its recurrence",
            new Object[] {rule.cronExpression(), campaign.campaignId()});
        fail(schedule, "Invalid recurrence expression: " + rule.cronExpression());
        return;
      }
    }
    complete(schedule, now);
  }

  /**
   * Plans from the schedule's own due time so the cadence does not drift with poll latency.
   * Occurrences that already lie in the past (for example after downtime) are skipped
   * rather than replayed.
   */
  private RecurrencePlan planAfter(RecurrenceRule rule, Schedule schedule, Instant now) {
    RecurrencePlan plan = planner.next(rule, schedule.scheduledFor(), schedule.executionCount());
    int skipped = 0;
    while (plan instanceof RecurrencePlan.Next next && !next.at().isAfter(now) && skipped++ < MAX_SKIPPED_OCCURRENCES) {
      plan = planner.next(rule, next.at(), schedule.executionCount());
    }
    return plan;
  }

  private void complete(Schedule schedule, Instant now) {
    ScheduleStatus status = connectionProvider.inTransaction(conn -> {
      ScheduleStatus target = retryQueue.countPending(conn, schedule.campaignId()) > 0
          ? ScheduleStatus.DRAINING : ScheduleStatus.COMPLETED;
      if (campaignStore.finish(conn, schedule.scheduleId(), ownerId, target, null, now) == 0) {
        return null;
      }
      if (target == ScheduleStatus.COMPLETED) {
        campaignStore.updateCampaignStatus(conn, schedule.campaignId(),
            EnumSet.of(CampaignStatus.ACTIVE, CampaignStatus.PAUSED), CampaignStatus.COMPLETED, now);
      }
      return target;
    });
    if (status == ScheduleStatus.COMPLETED) {
      metrics.incrementSchedulesCompleted();
    } else if (status == null) {
      logger.log(Level.WARNING, "Lost ownership of schedule {0} before completing it", schedule.scheduleId());
    }
  }

  private void fail(Schedule schedule, String reason) {
    Instant now = now();
    boolean failed = connectionProvider.inTransaction(conn -> {
      if (campaignStore.finish(conn, schedule.scheduleId(), ownerId, ScheduleStatus.FAILED, reason, now) == 0) {
        return false;
      }
      campaignStore.updateCampaignStatus(conn, schedule.campaignId(),
          EnumSet.of(CampaignStatus.ACTIVE, CampaignStatus.PAUSED), CampaignStatus.FAILED, now);
      return true;
    });
    if (failed) {
      metrics.incrementSchedulesFailed();
    }
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  /**
   * Cancels the tick schedule and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
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
   * Builder for {@link ScheduleDispatcher}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CampaignStores stores;
    private SendCollaborator sendCollaborator;
    private RetryQueue retryQueue;
    private SegmentResolver segmentResolver;
    private FrequencyGuard frequencyGuard;
    private RecurrencePlanner planner;
    private FailureClassifier failureClassifier;
    private InFlightTracker inFlightTracker;
    private int batchSize = 5;
    private long intervalMs = 60_000L;
    private Duration lockTimeout = Duration.ofMinutes(10);
    private String ownerId;
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
     * Sets the stores holding campaigns, schedules, deliveries and A/B tests.
     *
     * <p><b>Required.</b>
     */
    public Builder stores(CampaignStores stores) {
      this.stores = stores;
      return this;
    }

    /**
     * Sets the transport used to deliver content.
     *
     * <p><b>Required.</b>
     */
    public Builder sendCollaborator(SendCollaborator sendCollaborator) {
      this.sendCollaborator = sendCollaborator;
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
    public Builder segmentResolver(SegmentResolver segmentResolver) {
      this.segmentResolver = segmentResolver;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder frequencyGuard(FrequencyGuard frequencyGuard) {
      this.frequencyGuard = frequencyGuard;
      return this;
    }

    /**
     * <p>Optional. Defaults to a UTC {@link RecurrencePlanner}.
     */
    public Builder planner(RecurrencePlanner planner) {
      this.planner = planner;
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
     * <p>Optional. Defaults to a {@link DefaultInFlightTracker} whose TTL is the lock timeout.
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the maximum number of schedules handled per tick.
     *
     * <p>Optional. Defaults to {@code 5}. Must be &gt; 0.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the delay between the end of one tick and the start of the next.
     *
     * <p>Optional. Defaults to {@code 60000} ms. Must be &gt; 0.
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Sets how long a claim protects an executing schedule before another tick may take it over.
     *
     * <p>Optional. Defaults to 10 minutes. Must be positive and longer than the slowest execution.
     */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /**
     * Sets the identifier written into claimed schedules (e.g. hostname or pod name).
     *
     * <p>Optional. Defaults to a random {@code dispatcher-xxxxxxxx} id.
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
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

    /**
     * Builds the dispatcher. Call {@link ScheduleDispatcher#start()} to begin ticking.
     *
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if {@code batchSize}, {@code intervalMs} or
     *                                  {@code lockTimeout} is not positive
     */
    public ScheduleDispatcher build() {
      return new ScheduleDispatcher(this);
    }
  }
}
