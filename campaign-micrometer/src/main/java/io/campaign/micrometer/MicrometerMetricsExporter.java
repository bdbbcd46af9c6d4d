package io.campaign.micrometer;

import io.campaign.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code campaign.schedules.claimed} / {@code .completed} / {@code .failed}</li>
 *   <li>{@code campaign.ticks.skipped}: ticks discarded because the previous one was still running</li>
 *   <li>{@code campaign.deliveries.sent} / {@code .failed} / {@code .blocked}</li>
 *   <li>{@code campaign.recipients.suppressed}, tagged {@code reason=opted_out|frequency_capped}</li>
 *   <li>{@code campaign.retries.enqueued} / {@code .succeeded} / {@code .exhausted}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code campaign.schedule.lag.ms}: how late the oldest due schedule of the last tick was</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter schedulesClaimed;
  private final Counter schedulesCompleted;
  private final Counter schedulesFailed;
  private final Counter ticksSkipped;
  private final Counter deliveriesSent;
  private final Counter deliveriesFailed;
  private final Counter deliveriesBlocked;
  private final Counter retriesEnqueued;
  private final Counter retriesSucceeded;
  private final Counter retriesExhausted;
  private final Gauge lagGauge;
  private final Map<String, Counter> suppressedByReason = new ConcurrentHashMap<>();

  private final AtomicLong scheduleLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "campaign"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "campaign");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param namePrefix prefix for all meter names (e.g. {@code "marketing.campaign"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.schedulesClaimed = counter("schedules.claimed", "Schedules claimed for execution by this process");
    this.schedulesCompleted = counter("schedules.completed", "Schedules that reached COMPLETED");
    this.schedulesFailed = counter("schedules.failed", "Schedules that reached FAILED");
    this.ticksSkipped = counter("ticks.skipped", "Ticks discarded while the previous tick was running");
    this.deliveriesSent = counter("deliveries.sent", "Deliveries recorded as sent");
    this.deliveriesFailed = counter("deliveries.failed", "Deliveries recorded as failed");
    this.deliveriesBlocked = counter("deliveries.blocked", "Deliveries recorded as blocked by the recipient");
    this.retriesEnqueued = counter("retries.enqueued", "Failed sends scheduled for another attempt");
    this.retriesSucceeded = counter("retries.succeeded", "Retry entries delivered");
    this.retriesExhausted = counter("retries.exhausted", "Retry entries that ran out of attempts");

    this.lagGauge = Gauge.builder(namePrefix + ".schedule.lag.ms", scheduleLagMs, AtomicLong::get)
        .description("Lag of the oldest due schedule picked up by the last tick")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(namePrefix + "." + name)
        .description(description)
        .register(registry);
  }

  @Override
  public void incrementSchedulesClaimed() {
    if (closed) return;
    schedulesClaimed.increment();
  }

  @Override
  public void incrementSchedulesCompleted() {
    if (closed) return;
    schedulesCompleted.increment();
  }

  @Override
  public void incrementSchedulesFailed() {
    if (closed) return;
    schedulesFailed.increment();
  }

  @Override
  public void incrementTicksSkipped() {
    if (closed) return;
    ticksSkipped.increment();
  }

  @Override
  public void incrementDeliveriesSent() {
    if (closed) return;
    deliveriesSent.increment();
  }

  @Override
  public void incrementDeliveriesFailed() {
    if (closed) return;
    deliveriesFailed.increment();
  }

  @Override
  public void incrementDeliveriesBlocked() {
    if (closed) return;
    deliveriesBlocked.increment();
  }

  @Override
  public void incrementRecipientsSuppressed(String reason) {
    if (closed) return;
    suppressedByReason.computeIfAbsent(reason, r -> Counter.builder(namePrefix + ".recipients.suppressed")
        .description("Recipients skipped by the frequency guard")
        .tag("reason", r)
        .register(registry)).increment();
  }

  @Override
  public void incrementRetriesEnqueued() {
    if (closed) return;
    retriesEnqueued.increment();
  }

  @Override
  public void incrementRetriesSucceeded() {
    if (closed) return;
    retriesSucceeded.increment();
  }

  @Override
  public void incrementRetriesExhausted() {
    if (closed) return;
    retriesExhausted.increment();
  }

  @Override
  public void recordScheduleLagMs(long lagMs) {
    if (closed) return;
    scheduleLagMs.set(lagMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link io.campaign.CampaignEngine} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(schedulesClaimed, schedulesCompleted, schedulesFailed,
        ticksSkipped, deliveriesSent, deliveriesFailed, deliveriesBlocked,
        retriesEnqueued, retriesSucceeded, retriesExhausted, lagGauge));
    meters.addAll(suppressedByReason.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
