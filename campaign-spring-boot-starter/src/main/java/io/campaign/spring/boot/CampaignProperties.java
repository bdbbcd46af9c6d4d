package io.campaign.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the campaign engine.
 *
 * @see CampaignAutoConfiguration
 */
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

  /**
   * Whether the engine beans are created at all.
   */
  private boolean enabled = true;

  /**
   * Whether the dispatcher and retry drainer start polling once the context is up.
   */
  private boolean autoStart = true;

  /**
   * Claim owner id for this node. Blank means a generated id.
   */
  private String ownerId = "";

  /**
   * Zone used for daily, weekly and monthly recurrence arithmetic.
   */
  private String timeZone = "UTC";

  /**
   * Prefix applied to every campaign table name.
   */
  private String tablePrefix = "";

  private final Dispatcher dispatcher = new Dispatcher();
  private final Retry retry = new Retry();
  private final Frequency frequency = new Frequency();
  private final AbTest abTest = new AbTest();
  private final Metrics metrics = new Metrics();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public void setOwnerId(String ownerId) {
    this.ownerId = ownerId;
  }

  public String getTimeZone() {
    return timeZone;
  }

  public void setTimeZone(String timeZone) {
    this.timeZone = timeZone;
  }

  public String getTablePrefix() {
    return tablePrefix;
  }

  public void setTablePrefix(String tablePrefix) {
    this.tablePrefix = tablePrefix;
  }

  public Dispatcher getDispatcher() {
    return dispatcher;
  }

  public Retry getRetry() {
    return retry;
  }

  public Frequency getFrequency() {
    return frequency;
  }

  public AbTest getAbTest() {
    return abTest;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Dispatcher {
    private long intervalMs = 60_000;
    private int batchSize = 5;
    private int segmentPageSize = 500;
    private Duration lockTimeout = Duration.ofMinutes(10);

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getSegmentPageSize() {
      return segmentPageSize;
    }

    public void setSegmentPageSize(int segmentPageSize) {
      this.segmentPageSize = segmentPageSize;
    }

    public Duration getLockTimeout() {
      return lockTimeout;
    }

    public void setLockTimeout(Duration lockTimeout) {
      this.lockTimeout = lockTimeout;
    }
  }

  public static class Retry {
    private long intervalMs = 30_000;
    private int batchSize = 100;
    private int maxAttempts = 5;
    private Duration transientDelay = Duration.ofSeconds(60);
    private Duration rateLimitedDelay = Duration.ofMinutes(15);
    private double multiplier = 2.0;
    private Duration maxDelay = Duration.ofHours(24);
    private boolean claimLocking = false;

    public long getIntervalMs() {
      return intervalMs;
    }

    public void setIntervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
    }

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getTransientDelay() {
      return transientDelay;
    }

    public void setTransientDelay(Duration transientDelay) {
      this.transientDelay = transientDelay;
    }

    public Duration getRateLimitedDelay() {
      return rateLimitedDelay;
    }

    public void setRateLimitedDelay(Duration rateLimitedDelay) {
      this.rateLimitedDelay = rateLimitedDelay;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public Duration getMaxDelay() {
      return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
    }

    public boolean isClaimLocking() {
      return claimLocking;
    }

    public void setClaimLocking(boolean claimLocking) {
      this.claimLocking = claimLocking;
    }
  }

  public static class Frequency {
    private int defaultWeeklyCap = 7;

    public int getDefaultWeeklyCap() {
      return defaultWeeklyCap;
    }

    public void setDefaultWeeklyCap(int defaultWeeklyCap) {
      this.defaultWeeklyCap = defaultWeeklyCap;
    }
  }

  public static class AbTest {
    private double significanceThreshold = 0.05;

    public double getSignificanceThreshold() {
      return significanceThreshold;
    }

    public void setSignificanceThreshold(double significanceThreshold) {
      this.significanceThreshold = significanceThreshold;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "campaign";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
