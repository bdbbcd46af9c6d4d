package io.campaign.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Recurrence pattern of a campaign together with its bounds.
 *
 * @param pattern        how the campaign repeats
 * @param cronExpression cron expression, only used (and required) for {@link RecurrencePattern#CUSTOM}
 * @param endAt          optional last instant a run may be scheduled at ({@code null} = unbounded)
 * @param maxOccurrences optional cap on the number of executions ({@code null} = unbounded)
 */
public record RecurrenceRule(
    RecurrencePattern pattern,
    String cronExpression,
    Instant endAt,
    Integer maxOccurrences
) {
  public RecurrenceRule {
    Objects.requireNonNull(pattern, "pattern");
    if (pattern == RecurrencePattern.CUSTOM && (cronExpression == null || cronExpression.isBlank())) {
      throw new IllegalArgumentException("cronExpression is required for custom recurrence");
    }
    if (maxOccurrences != null && maxOccurrences <= 0) {
      throw new IllegalArgumentException("maxOccurrences must be > 0, got: " + maxOccurrences);
    }
  }

  public static RecurrenceRule once() {
    return new RecurrenceRule(RecurrencePattern.NONE, null, null, null);
  }

  public static RecurrenceRule of(RecurrencePattern pattern) {
    return new RecurrenceRule(pattern, null, null, null);
  }

  public static RecurrenceRule cron(String cronExpression) {
    return new RecurrenceRule(RecurrencePattern.CUSTOM, cronExpression, null, null);
  }

  public RecurrenceRule endingAt(Instant endAt) {
    return new RecurrenceRule(pattern, cronExpression, endAt, maxOccurrences);
  }

  public RecurrenceRule limitedTo(int maxOccurrences) {
    return new RecurrenceRule(pattern, cronExpression, endAt, maxOccurrences);
  }

  public boolean isRecurring() {
    return pattern.isRecurring();
  }
}
