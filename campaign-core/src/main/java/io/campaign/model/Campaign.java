package io.campaign.model;

import java.time.Instant;

/**
 * Read-only record of a persisted campaign row.
 *
 * @param segmentId target segment, or {@code null} to address every recipient
 */
public record Campaign(
    String campaignId,
    String title,
    String content,
    String segmentId,
    RecurrenceRule recurrence,
    CampaignStatus status,
    Instant createdAt,
    Instant updatedAt
) {}
