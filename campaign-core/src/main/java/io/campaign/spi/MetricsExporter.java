package io.campaign.spi;

/**
 * Observability hook for exporting engine counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of schedules this process claimed for execution.
   */
  void incrementSchedulesClaimed();

  /**
   * Increments the count of schedules that reached {@code COMPLETED}.
   */
  void incrementSchedulesCompleted();

  /**
   * Increments the count of schedules that reached {@code FAILED}.
   */
  void incrementSchedulesFailed();

  /**
   * Increments the count of ticks discarded because the previous tick was still running.
   */
  default void incrementTicksSkipped() {
  }

  void incrementDeliveriesSent();

  void incrementDeliveriesFailed();

  void incrementDeliveriesBlocked();

  /**
   * Increments the count of recipients skipped by the frequency guard.
   *
   * @param reason {@code opted_out} or {@code frequency_capped}
   */
  default void incrementRecipientsSuppressed(String reason) {
  }

  void incrementRetriesEnqueued();

  void incrementRetriesSucceeded();

  /**
   * Increments the count of retry entries that ran out of attempts.
   */
  void incrementRetriesExhausted();

  /**
   * Records how late the oldest due schedule of a tick was picked up.
   *
   * @param lagMs lag in milliseconds (always non-negative)
   */
  void recordScheduleLagMs(long lagMs);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementSchedulesClaimed() {
    }

    @Override
    public void incrementSchedulesCompleted() {
    }

    @Override
    public void incrementSchedulesFailed() {
    }

    @Override
    public void incrementDeliveriesSent() {
    }

    @Override
    public void incrementDeliveriesFailed() {
    }

    @Override
    public void incrementDeliveriesBlocked() {
    }

    @Override
    public void incrementRetriesEnqueued() {
    }

    @Override
    public void incrementRetriesSucceeded() {
    }

    @Override
    public void incrementRetriesExhausted() {
    }

    @Override
    public void recordScheduleLagMs(long lagMs) {
    }
  }
}
