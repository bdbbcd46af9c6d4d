package io.campaign.analytics;

import io.campaign.model.AbTest;
import io.campaign.model.AbTestOutcome;
import io.campaign.model.AbTestStatus;
import io.campaign.model.Variant;
import io.campaign.model.VariantStats;
import io.campaign.spi.AbTestStore;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.EngagementStore;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates A/B tests and picks a winner between their two variants.
 *
 * <p>The winner rule is a coarse heuristic rather than a statistical test: the variant with the
 * higher engagement rate wins when the absolute gap exceeds the significance threshold.
 */
public final class AbTestManager {
  private static final Logger logger = Logger.getLogger(AbTestManager.class.getName());

  public static final double DEFAULT_SPLIT_RATIO = 0.5;
  public static final double DEFAULT_SIGNIFICANCE_THRESHOLD = 0.05;
  public static final List<String> DEFAULT_METRICS = List.of("delivery_rate", "engagement_rate");

  private final ConnectionProvider connectionProvider;
  private final AbTestStore abTestStore;
  private final CampaignStore campaignStore;
  private final EngagementStore engagementStore;
  private final double significanceThreshold;
  private final Clock clock;

  private AbTestManager(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.abTestStore = Objects.requireNonNull(builder.abTestStore, "abTestStore");
    this.campaignStore = Objects.requireNonNull(builder.campaignStore, "campaignStore");
    this.engagementStore = Objects.requireNonNull(builder.engagementStore, "engagementStore");
    if (builder.significanceThreshold < 0 || builder.significanceThreshold >= 1) {
      throw new IllegalArgumentException("significanceThreshold must be in [0, 1)");
    }
    this.significanceThreshold = builder.significanceThreshold;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Result of comparing two variants.
   */
  public record Results(AbTest test, VariantStats variantA, VariantStats variantB, AbTestOutcome winner) {}

  public AbTest createTest(String campaignId, String variantA, String variantB) {
    return createTest(campaignId, variantA, variantB, DEFAULT_SPLIT_RATIO, DEFAULT_METRICS);
  }

  /**
   * Creates an active test for a campaign. A campaign has at most one active test.
   *
   * @param splitRatio fraction of recipients receiving variant A, strictly between 0 and 1
   * @param metrics    metric names to report, {@code null} or empty for the defaults
   * @throws IllegalStateException if the campaign is unknown or already has an active test
   */
  public AbTest createTest(String campaignId, String variantA, String variantB, double splitRatio,
      List<String> metrics) {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(variantA, "variantA");
    Objects.requireNonNull(variantB, "variantB");
    if (!(splitRatio > 0 && splitRatio < 1)) {
      throw new IllegalArgumentException("splitRatio must be in (0, 1): " + splitRatio);
    }
    List<String> effectiveMetrics = metrics == null || metrics.isEmpty() ? DEFAULT_METRICS : metrics;
    AbTest test = new AbTest(UUID.randomUUID().toString(), campaignId, variantA, variantB, splitRatio,
        effectiveMetrics, AbTestStatus.ACTIVE, null, now(), null);
    connectionProvider.inTransaction(conn -> {
      if (campaignStore.findCampaign(conn, campaignId).isEmpty()) {
        throw new IllegalStateException("Unknown campaign: " + campaignId);
      }
      boolean active = abTestStore.findLatestByCampaign(conn, campaignId).filter(AbTest::isActive).isPresent();
      if (active) {
        throw new IllegalStateException("Campaign " + campaignId + " already has an active A/B test");
      }
      abTestStore.insert(conn, test);
      return null;
    });
    return test;
  }

  /**
   * Current per-variant statistics and the winner they imply. Does not store anything.
   */
  public Results results(String testId) {
    return connectionProvider.withConnection(conn -> {
      AbTest test = abTestStore.find(conn, testId)
          .orElseThrow(() -> new IllegalStateException("Unknown A/B test: " + testId));
      VariantStats a = engagementStore.variantStats(conn, test.campaignId(), Variant.A);
      VariantStats b = engagementStore.variantStats(conn, test.campaignId(), Variant.B);
      return new Results(test, a, b, determineWinner(a, b, significanceThreshold));
    });
  }

  /**
   * Computes the winner and stores it, completing the test. Completing an already completed
   * test returns its stored winner.
   */
  public AbTestOutcome complete(String testId) {
    Results results = results(testId);
    if (!results.test().isActive()) {
      return results.test().winner();
    }
    AbTestOutcome winner = results.winner();
    int updated = connectionProvider.withConnection(conn -> abTestStore.complete(conn, testId, winner, now()));
    if (updated == 0) {
      return connectionProvider.withConnection(conn -> abTestStore.find(conn, testId))
          .map(AbTest::winner)
          .orElse(winner);
    }
    logger.log(Level.INFO, "A/B test {0} completed: {1}", new Object[] {testId, winner.code()});
    return winner;
  }

  public AbTestOutcome determineWinner(VariantStats a, VariantStats b) {
    return determineWinner(a, b, significanceThreshold);
  }

  /**
   * Zero sends on either side yields {@code INSUFFICIENT_DATA}; a rate gap strictly above
   * {@code threshold} names the better variant; anything else is no significant difference.
   */
  public static AbTestOutcome determineWinner(VariantStats a, VariantStats b, double threshold) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    if (a.sent() == 0 || b.sent() == 0) {
      return AbTestOutcome.INSUFFICIENT_DATA;
    }
    double rateA = a.engagementRate();
    double rateB = b.engagementRate();
    if (Math.abs(rateA - rateB) <= threshold) {
      return AbTestOutcome.NO_SIGNIFICANT_DIFFERENCE;
    }
    return rateA > rateB ? AbTestOutcome.VARIANT_A : AbTestOutcome.VARIANT_B;
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }

  /**
   * Builder for {@link AbTestManager}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private AbTestStore abTestStore;
    private CampaignStore campaignStore;
    private EngagementStore engagementStore;
    private double significanceThreshold = DEFAULT_SIGNIFICANCE_THRESHOLD;
    private Clock clock;

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
    public Builder abTestStore(AbTestStore abTestStore) {
      this.abTestStore = abTestStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder campaignStore(CampaignStore campaignStore) {
      this.campaignStore = campaignStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder engagementStore(EngagementStore engagementStore) {
      this.engagementStore = engagementStore;
      return this;
    }

    /**
     * Sets the minimum absolute engagement-rate gap for a variant to win.
     *
     * <p>Optional. Defaults to {@code 0.05} (5 percentage points).
     */
    public Builder significanceThreshold(double significanceThreshold) {
      this.significanceThreshold = significanceThreshold;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public AbTestManager build() {
      return new AbTestManager(this);
    }
  }
}
