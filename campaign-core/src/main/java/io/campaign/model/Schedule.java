package io.campaign.model;

import java.time.Instant;

/**
 * Read-only record of the single rolling schedule row of a campaign.
 *
 * @param executionOrder tie-break among schedules due at the same tick (lower runs first)
 * @param executionCount number of executions started so far
 * @param pauseRequested set when a pause arrived while the schedule was executing
 */
public record Schedule(
    String scheduleId,
    String campaignId,
    Instant scheduledFor,
    ScheduleStatus status,
    int executionOrder,
    int executionCount,
    boolean pauseRequested,
    String lockedBy,
    Instant lockedAt,
    Instant lastExecutedAt,
    String lastError,
    Instant updatedAt
) {}
