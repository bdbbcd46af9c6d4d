package io.campaign.model;

import java.time.Instant;

/**
 * A named, persisted {@link SegmentFilter}. Resolved on demand.
 */
public record Segment(
    String segmentId,
    String name,
    String description,
    SegmentFilter filter,
    Instant createdAt
) {}
