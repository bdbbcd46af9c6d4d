package io.campaign.retry;

import io.campaign.model.Variant;

import java.util.Objects;

/**
 * Identifies the send a retry entry re-attempts.
 *
 * @param occurrence execution count of the schedule run the send belonged to
 * @param variant    A/B arm the recipient was assigned, or {@code null}
 */
public record RetryTarget(String campaignId, String scheduleId, int occurrence, String recipientId, Variant variant) {
  public RetryTarget {
    Objects.requireNonNull(campaignId, "campaignId");
    Objects.requireNonNull(scheduleId, "scheduleId");
    Objects.requireNonNull(recipientId, "recipientId");
  }
}
