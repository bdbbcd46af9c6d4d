package io.campaign.dispatch;

import io.campaign.SendError;
import io.campaign.frequency.FrequencyGuard;
import io.campaign.model.Delivery;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.ErrorClass;
import io.campaign.retry.RetryTarget;
import io.campaign.spi.DeliveryStore;
import io.campaign.spi.MetricsExporter;

import java.sql.Connection;
import java.time.Instant;
import java.util.UUID;

/**
 * Writes terminal delivery rows and the side effects that go with them (weekly send counter,
 * metrics). Shared by the schedule executor and the retry drainer.
 */
final class DeliveryRecorder {
  private final DeliveryStore deliveryStore;
  private final FrequencyGuard frequencyGuard;
  private final MetricsExporter metrics;

  DeliveryRecorder(DeliveryStore deliveryStore, FrequencyGuard frequencyGuard, MetricsExporter metrics) {
    this.deliveryStore = deliveryStore;
    this.frequencyGuard = frequencyGuard;
    this.metrics = metrics;
  }

  void sent(Connection conn, RetryTarget target, String retryEntryId, Instant now) {
    boolean inserted = deliveryStore.insertIfAbsent(conn, new Delivery(UUID.randomUUID().toString(),
        target.campaignId(), target.scheduleId(), target.occurrence(), target.recipientId(),
        target.variant(), DeliveryStatus.SENT, null, null, null, retryEntryId, now));
    if (inserted) {
      frequencyGuard.recordSend(conn, target.recipientId(), now);
      metrics.incrementDeliveriesSent();
    }
  }

  DeliveryStatus failed(Connection conn, RetryTarget target, DeliveryStatus status, ErrorClass errorClass,
      SendError error, String retryEntryId, Instant now) {
    boolean inserted = deliveryStore.insertIfAbsent(conn, new Delivery(UUID.randomUUID().toString(),
        target.campaignId(), target.scheduleId(), target.occurrence(), target.recipientId(),
        target.variant(), status, errorClass, error.code(), error.describe(), retryEntryId, now));
    if (inserted) {
      if (status == DeliveryStatus.BLOCKED) {
        metrics.incrementDeliveriesBlocked();
      } else {
        metrics.incrementDeliveriesFailed();
      }
    }
    return status;
  }
}
