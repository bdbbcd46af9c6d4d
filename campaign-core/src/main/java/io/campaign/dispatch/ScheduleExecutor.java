package io.campaign.dispatch;

import io.campaign.SendError;
import io.campaign.frequency.Eligibility;
import io.campaign.frequency.FrequencyGuard;
import io.campaign.model.AbTest;
import io.campaign.model.Campaign;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.RetryEntry;
import io.campaign.model.RetryStatus;
import io.campaign.model.Schedule;
import io.campaign.model.SegmentFilter;
import io.campaign.model.Variant;
import io.campaign.retry.RetryQueue;
import io.campaign.retry.RetryTarget;
import io.campaign.segment.SegmentResolver;
import io.campaign.spi.AbTestStore;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.DeliveryStore;
import io.campaign.spi.MetricsExporter;

import java.time.Clock;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans one claimed schedule execution out to its recipients.
 *
 * <p>Recipients are read page by page from the segment. For each one the executor skips
 * duplicates (already delivered for this occurrence, or waiting in the retry queue), applies
 * the {@link FrequencyGuard}, sends, and records the outcome: a {@code SENT} delivery, a
 * {@code FAILED}/{@code BLOCKED} delivery for permanent errors, or a retry queue entry for
 * transient ones. Neither a failed send nor an exception while handling one recipient stops
 * the batch; the latter is logged and counted in {@link ExecutionReport#errors()}. Failures
 * reading the segment propagate and abort the execution; the schedule's claim then expires and
 * the execution is picked up again, with the duplicate check keeping it idempotent.
 */
final class ScheduleExecutor {
  private static final Logger logger = Logger.getLogger(ScheduleExecutor.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;
  private final AbTestStore abTestStore;
  private final SegmentResolver segmentResolver;
  private final FrequencyGuard frequencyGuard;
  private final RetryQueue retryQueue;
  private final Sender sender;
  private final DeliveryRecorder recorder;
  private final Clock clock;
  private final MetricsExporter metrics;

  ScheduleExecutor(ConnectionProvider connectionProvider, DeliveryStore deliveryStore, AbTestStore abTestStore,
      SegmentResolver segmentResolver, FrequencyGuard frequencyGuard, RetryQueue retryQueue, Sender sender,
      Clock clock, MetricsExporter metrics) {
    this.connectionProvider = connectionProvider;
    this.deliveryStore = deliveryStore;
    this.abTestStore = abTestStore;
    this.segmentResolver = segmentResolver;
    this.frequencyGuard = frequencyGuard;
    this.retryQueue = retryQueue;
    this.sender = sender;
    this.recorder = new DeliveryRecorder(deliveryStore, frequencyGuard, metrics);
    this.clock = clock;
    this.metrics = metrics;
  }

  /**
   * Executes the schedule's current occurrence.
   *
   * @param schedule the schedule as claimed (its execution count is the occurrence number)
   * @throws UndeliverableCampaignException if the campaign's segment does not exist
   */
  ExecutionReport execute(Schedule schedule, Campaign campaign) {
    SegmentFilter filter = resolveFilter(campaign);
    AbTest abTest = connectionProvider.withConnection(
        conn -> abTestStore.findLatestByCampaign(conn, campaign.campaignId()))
        .filter(AbTest::isActive)
        .orElse(null);

    Tally tally = new Tally();
    String cursor = null;
    while (true) {
      List<String> page = segmentResolver.page(filter, cursor);
      for (String recipientId : page) {
        tally.resolved++;
        Variant variant = abTest == null ? null : abTest.assign(recipientId);
        String content = abTest == null ? campaign.content() : abTest.contentFor(variant);
        RetryTarget target = new RetryTarget(campaign.campaignId(), schedule.scheduleId(),
            schedule.executionCount(), recipientId, variant);
        try {
          deliver(target, content, tally);
        } catch (RuntimeException e) {
          tally.errors++;
          logger.log(Level.SEVERE, "Delivery to recipientId=" + recipientId + " of campaignId="
              + campaign.campaignId() + " failed; continuing with the next recipient", e);
        }
      }
      if (page.size() < segmentResolver.pageSize()) {
        break;
      }
      cursor = page.get(page.size() - 1);
    }
    ExecutionReport report = tally.toReport();
    logger.log(Level.INFO, "Executed campaignId={0} occurrence={1}: {2}",
        new Object[] {campaign.campaignId(), schedule.executionCount(), report});
    return report;
  }

  private SegmentFilter resolveFilter(Campaign campaign) {
    if (campaign.segmentId() == null) {
      return SegmentFilter.matchAll();
    }
    return segmentResolver.segment(campaign.segmentId())
        .orElseThrow(() -> new UndeliverableCampaignException(
            "Segment " + campaign.segmentId() + " of campaign " + campaign.campaignId() + " does not exist"))
        .filter();
  }

  private void deliver(RetryTarget target, String content, Tally tally) {
    Eligibility eligibility = connectionProvider.withConnection(conn -> {
      if (deliveryStore.exists(conn, target.scheduleId(), target.occurrence(), target.recipientId())
          || retryQueue.hasPending(conn, target.campaignId(), target.recipientId())) {
        return null;
      }
      return frequencyGuard.check(conn, target.recipientId());
    });
    if (eligibility == null) {
      tally.duplicates++;
      return;
    }
    if (!eligibility.isEligible()) {
      tally.suppressed++;
      metrics.incrementRecipientsSuppressed(eligibility.reason());
      logger.log(Level.FINE, "Skipping recipientId={0}: {1}", new Object[] {target.recipientId(), eligibility});
      return;
    }

    SendResult result = sender.send(target.recipientId(), content);
    if (result.isSuccess()) {
      connectionProvider.withConnection(conn -> {
        recorder.sent(conn, target, null, clock.instant());
        return null;
      });
      tally.sent++;
      return;
    }

    SendError error = result.error();
    if (!result.errorClass().isRetryable()) {
      DeliveryStatus status = sender.classifier().terminalStatus(error);
      connectionProvider.withConnection(
          conn -> recorder.failed(conn, target, status, result.errorClass(), error, null, clock.instant()));
      tally.count(status);
      return;
    }

    RetryEntry entry = retryQueue.enqueue(target, result.errorClass(), error);
    if (entry.status() == RetryStatus.FAILED) {
      // no retry budget at all: the failure is final right away
      connectionProvider.withConnection(conn -> recorder.failed(conn, target, DeliveryStatus.FAILED,
          result.errorClass(), error, entry.entryId(), clock.instant()));
      tally.failed++;
    } else {
      tally.retrying++;
      logger.log(Level.FINE, "Queued retry for recipientId={0} at {1}",
          new Object[] {target.recipientId(), entry.nextRetryAt()});
    }
  }

  private static final class Tally {
    int resolved;
    int sent;
    int failed;
    int blocked;
    int retrying;
    int suppressed;
    int duplicates;
    int errors;

    void count(DeliveryStatus status) {
      if (status == DeliveryStatus.BLOCKED) {
        blocked++;
      } else {
        failed++;
      }
    }

    ExecutionReport toReport() {
      return new ExecutionReport(resolved, sent, failed, blocked, retrying, suppressed, duplicates, errors);
    }
  }
}
