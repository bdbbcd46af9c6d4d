package io.campaign.model;

import java.time.Instant;

/**
 * Outcome of sending one execution of a campaign to one recipient.
 *
 * <p>Unique per {@code (scheduleId, occurrence, recipientId)}.
 *
 * @param occurrence   execution count of the schedule run this delivery belongs to
 * @param variant      A/B arm, or {@code null} when the campaign has no active test
 * @param errorClass   classification of the failure, {@code null} for sent deliveries
 * @param retryEntryId retry queue entry that produced this outcome, if any
 */
public record Delivery(
    String deliveryId,
    String campaignId,
    String scheduleId,
    int occurrence,
    String recipientId,
    Variant variant,
    DeliveryStatus status,
    ErrorClass errorClass,
    String errorCode,
    String errorMessage,
    String retryEntryId,
    Instant createdAt
) {}
