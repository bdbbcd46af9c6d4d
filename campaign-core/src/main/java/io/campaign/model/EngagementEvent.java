package io.campaign.model;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only record of a recipient interacting with a delivered campaign.
 */
public record EngagementEvent(
    String eventId,
    String campaignId,
    String recipientId,
    EngagementType type,
    Map<String, String> metadata,
    Instant occurredAt
) {
  public EngagementEvent {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
