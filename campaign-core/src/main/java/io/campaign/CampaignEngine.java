package io.campaign;

import io.campaign.analytics.AbTestManager;
import io.campaign.analytics.EngagementTracker;
import io.campaign.dispatch.FailureClassifier;
import io.campaign.dispatch.RetryDrainer;
import io.campaign.dispatch.ScheduleDispatcher;
import io.campaign.frequency.FrequencyGuard;
import io.campaign.recurrence.RecurrencePlanner;
import io.campaign.retry.BackoffPolicy;
import io.campaign.retry.RetryQueue;
import io.campaign.segment.SegmentResolver;
import io.campaign.spi.CampaignStores;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the schedule dispatcher, the retry drainer and the operator
 * facades over one set of stores into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (CampaignEngine engine = CampaignEngine.builder()
 *     .connectionProvider(connectionProvider)
 *     .stores(JdbcCampaignStores.create(dataSource))
 *     .sendCollaborator(transport)
 *     .build()) {
 *   engine.start();
 *   engine.operations().createCampaign(definition);
 * }
 * }</pre>
 */
public final class CampaignEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CampaignEngine.class.getName());

  private final ScheduleDispatcher dispatcher;
  private final RetryDrainer retryDrainer;
  private final RetryQueue retryQueue;
  private final SegmentResolver segmentResolver;
  private final FrequencyGuard frequencyGuard;
  private final CampaignOperations operations;
  private final EngagementTracker engagementTracker;
  private final AbTestManager abTestManager;
  private final MetricsExporter metrics;

  private CampaignEngine(Builder builder) {
    ConnectionProvider connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    CampaignStores stores = Objects.requireNonNull(builder.stores, "stores");
    Objects.requireNonNull(builder.sendCollaborator, "sendCollaborator");
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    RetryQueue.Builder retryQueueBuilder = RetryQueue.builder()
        .connectionProvider(connectionProvider)
        .store(stores.retries())
        .maxAttempts(builder.maxAttempts)
        .clock(clock)
        .metrics(metrics);
    if (builder.backoffPolicy != null) {
      retryQueueBuilder.backoffPolicy(builder.backoffPolicy);
    }
    this.retryQueue = retryQueueBuilder.build();
    this.segmentResolver = new SegmentResolver(connectionProvider, stores.segments(), stores.recipients(),
        builder.segmentPageSize);
    this.frequencyGuard = new FrequencyGuard(connectionProvider, stores.recipients(), builder.defaultWeeklyCap);

    this.dispatcher = ScheduleDispatcher.builder()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .sendCollaborator(builder.sendCollaborator)
        .retryQueue(retryQueue)
        .segmentResolver(segmentResolver)
        .frequencyGuard(frequencyGuard)
        .planner(new RecurrencePlanner(builder.zone))
        .failureClassifier(builder.failureClassifier)
        .batchSize(builder.dispatchBatchSize)
        .intervalMs(builder.dispatchIntervalMs)
        .lockTimeout(builder.lockTimeout)
        .ownerId(builder.ownerId)
        .clock(clock)
        .metrics(metrics)
        .build();

    RetryDrainer.Builder drainerBuilder = RetryDrainer.builder()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .retryQueue(retryQueue)
        .sendCollaborator(builder.sendCollaborator)
        .frequencyGuard(frequencyGuard)
        .failureClassifier(builder.failureClassifier)
        .batchSize(builder.retryBatchSize)
        .intervalMs(builder.retryIntervalMs)
        .clock(clock)
        .metrics(metrics);
    if (builder.retryClaimLocking) {
      drainerBuilder.claimLocking(dispatcher.ownerId(), builder.lockTimeout);
    }
    this.retryDrainer = drainerBuilder.build();

    this.operations = new CampaignOperations(connectionProvider, stores, retryQueue, frequencyGuard, clock);
    this.engagementTracker = new EngagementTracker(connectionProvider, stores.deliveries(), stores.engagement(), clock);
    this.abTestManager = AbTestManager.builder()
        .connectionProvider(connectionProvider)
        .abTestStore(stores.abTests())
        .campaignStore(stores.campaigns())
        .engagementStore(stores.engagement())
        .significanceThreshold(builder.significanceThreshold)
        .clock(clock)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts both poll loops.
   */
  public void start() {
    dispatcher.start();
    retryDrainer.start();
    logger.info("Campaign engine started with owner id " + dispatcher.ownerId());
  }

  public ScheduleDispatcher dispatcher() {
    return dispatcher;
  }

  public RetryDrainer retryDrainer() {
    return retryDrainer;
  }

  public RetryQueue retryQueue() {
    return retryQueue;
  }

  public SegmentResolver segmentResolver() {
    return segmentResolver;
  }

  public FrequencyGuard frequencyGuard() {
    return frequencyGuard;
  }

  public CampaignOperations operations() {
    return operations;
  }

  public EngagementTracker engagement() {
    return engagementTracker;
  }

  public AbTestManager abTests() {
    return abTestManager;
  }

  /**
   * Shuts down components in order: retry drainer, dispatcher, then the metrics exporter if
   * it is closeable.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      retryDrainer.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link CampaignEngine}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private CampaignStores stores;
    private SendCollaborator sendCollaborator;
    private FailureClassifier failureClassifier;
    private BackoffPolicy backoffPolicy;
    private int maxAttempts = RetryQueue.DEFAULT_MAX_ATTEMPTS;
    private int defaultWeeklyCap = FrequencyGuard.DEFAULT_WEEKLY_CAP;
    private int segmentPageSize = 500;
    private int dispatchBatchSize = 5;
    private long dispatchIntervalMs = 60_000L;
    private int retryBatchSize = 100;
    private long retryIntervalMs = 30_000L;
    private boolean retryClaimLocking;
    private Duration lockTimeout = Duration.ofMinutes(10);
    private String ownerId;
    private double significanceThreshold = AbTestManager.DEFAULT_SIGNIFICANCE_THRESHOLD;
    private ZoneId zone = ZoneId.of("UTC");
    private Clock clock;
    private MetricsExporter metrics;
    private final AtomicBoolean built = new AtomicBoolean(false);

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
     * Sets the transport that delivers content to one recipient.
     *
     * <p><b>Required.</b>
     */
    public Builder sendCollaborator(SendCollaborator sendCollaborator) {
      this.sendCollaborator = sendCollaborator;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link io.campaign.dispatch.DefaultFailureClassifier}.
     */
    public Builder failureClassifier(FailureClassifier failureClassifier) {
      this.failureClassifier = failureClassifier;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link io.campaign.retry.GeometricBackoffPolicy#defaults()}.
     */
    public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
      this.backoffPolicy = backoffPolicy;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5}.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 7} sends per week.
     */
    public Builder defaultWeeklyCap(int defaultWeeklyCap) {
      this.defaultWeeklyCap = defaultWeeklyCap;
      return this;
    }

    /**
     * Sets how many recipient ids are read per page during fan-out.
     *
     * <p>Optional. Defaults to {@code 500}.
     */
    public Builder segmentPageSize(int segmentPageSize) {
      this.segmentPageSize = segmentPageSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5} schedules per tick.
     */
    public Builder dispatchBatchSize(int dispatchBatchSize) {
      this.dispatchBatchSize = dispatchBatchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 60000} ms.
     */
    public Builder dispatchIntervalMs(long dispatchIntervalMs) {
      this.dispatchIntervalMs = dispatchIntervalMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 100} entries per drain.
     */
    public Builder retryBatchSize(int retryBatchSize) {
      this.retryBatchSize = retryBatchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 30000} ms.
     */
    public Builder retryIntervalMs(long retryIntervalMs) {
      this.retryIntervalMs = retryIntervalMs;
      return this;
    }

    /**
     * Makes the retry drainer claim due entries under this engine's owner id, for deployments
     * where several engines share one database.
     *
     * <p>Optional. Defaults to {@code false}.
     */
    public Builder retryClaimLocking(boolean retryClaimLocking) {
      this.retryClaimLocking = retryClaimLocking;
      return this;
    }

    /**
     * Sets how long a claim on a schedule or retry entry is honoured before it may be taken over.
     *
     * <p>Optional. Defaults to 10 minutes.
     */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
      return this;
    }

    /**
     * <p>Optional. Defaults to a random {@code dispatcher-xxxxxxxx} id.
     */
    public Builder ownerId(String ownerId) {
      this.ownerId = ownerId;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 0.05}.
     */
    public Builder significanceThreshold(double significanceThreshold) {
      this.significanceThreshold = significanceThreshold;
      return this;
    }

    /**
     * Sets the zone used for calendar recurrence arithmetic.
     *
     * <p>Optional. Defaults to UTC.
     */
    public Builder zone(ZoneId zone) {
      this.zone = Objects.requireNonNull(zone, "zone");
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
     * @throws IllegalStateException if build() was already called
     */
    public CampaignEngine build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new CampaignEngine(this);
    }
  }
}
