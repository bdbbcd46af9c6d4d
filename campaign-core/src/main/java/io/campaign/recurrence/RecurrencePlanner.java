package io.campaign.recurrence;

import io.campaign.model.RecurrenceRule;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Derives the next execution time of a recurring campaign from its rule and last run.
 *
 * <p>Pure: the answer depends only on the arguments and the configured zone.
 * <ul>
 *   <li>{@code daily} / {@code weekly}: one day / seven days later.</li>
 *   <li>{@code monthly}: one calendar month later in the planner's zone. A day-of-month that
 *       does not exist in the target month is clamped to its last day (Jan 31 gives Feb 28 or
 *       Feb 29), and later months continue from the clamped day.</li>
 *   <li>{@code custom}: the first cron fire time strictly after the last run. Five-field
 *       expressions ({@code min hour dom mon dow}) run at second zero; six-field expressions
 *       are used as-is.</li>
 * </ul>
 * The plan is {@link RecurrencePlan.Done} once {@code executionCount} reaches
 * {@code maxOccurrences}, when the next time would be after {@code endAt}, or when the cron
 * expression is malformed.
 */
public final class RecurrencePlanner {
  private final ZoneId zone;

  public RecurrencePlanner() {
    this(ZoneOffset.UTC);
  }

  /**
   * @param zone zone used for calendar arithmetic and cron evaluation
   */
  public RecurrencePlanner(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public ZoneId zone() {
    return zone;
  }

  /**
   * Plans the run after {@code lastRun}.
   *
   * @param rule           pattern and bounds
   * @param lastRun        when the most recent execution happened
   * @param executionCount executions so far, including the one at {@code lastRun}
   * @return the next run time, or a terminal signal
   */
  public RecurrencePlan next(RecurrenceRule rule, Instant lastRun, int executionCount) {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(lastRun, "lastRun");
    if (rule.maxOccurrences() != null && executionCount >= rule.maxOccurrences()) {
      return RecurrencePlan.done(RecurrencePlan.DoneReason.MAX_OCCURRENCES_REACHED);
    }
    ZonedDateTime last = lastRun.atZone(zone);
    ZonedDateTime next;
    switch (rule.pattern()) {
      case NONE:
        return RecurrencePlan.done(RecurrencePlan.DoneReason.NOT_RECURRING);
      case DAILY:
        next = last.plusDays(1);
        break;
      case WEEKLY:
        next = last.plusWeeks(1);
        break;
      case MONTHLY:
        next = last.plusMonths(1);
        break;
      case CUSTOM:
        next = nextCronTime(rule.cronExpression(), last);
        if (next == null) {
          return RecurrencePlan.done(RecurrencePlan.DoneReason.INVALID_EXPRESSION);
        }
        break;
      default:
        throw new IllegalStateException("Unhandled pattern: " + rule.pattern());
    }
    Instant nextAt = next.toInstant();
    if (rule.endAt() != null && nextAt.isAfter(rule.endAt())) {
      return RecurrencePlan.done(RecurrencePlan.DoneReason.END_DATE_PASSED);
    }
    return RecurrencePlan.next(nextAt);
  }

  /**
   * Returns whether {@code expression} is a cron expression this planner accepts.
   */
  public static boolean isValidCron(String expression) {
    return parseCron(expression) != null;
  }

  private static ZonedDateTime nextCronTime(String expression, ZonedDateTime after) {
    CronExpression cron = parseCron(expression);
    return cron == null ? null : cron.next(after);
  }

  private static CronExpression parseCron(String expression) {
    if (expression == null || expression.isBlank()) {
      return null;
    }
    String normalized = expression.trim();
    if (normalized.split("\\s+").length == 5) {
      normalized = "0 " + normalized;
    }
    try {
      return CronExpression.parse(normalized);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
