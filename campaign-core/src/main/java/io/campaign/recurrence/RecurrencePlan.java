package io.campaign.recurrence;

import java.time.Instant;
import java.util.Objects;

/**
 * Answer of {@link RecurrencePlanner#next}: either the next run time or a terminal signal.
 */
public sealed interface RecurrencePlan permits RecurrencePlan.Next, RecurrencePlan.Done {

  static Next next(Instant at) {
    return new Next(at);
  }

  static Done done(DoneReason reason) {
    return new Done(reason);
  }

  default boolean isDone() {
    return this instanceof Done;
  }

  /**
   * Why no further execution is planned.
   */
  enum DoneReason {
    /** The campaign does not repeat. */
    NOT_RECURRING,
    /** The execution count reached the configured maximum. */
    MAX_OCCURRENCES_REACHED,
    /** The next run would fall after the end date. */
    END_DATE_PASSED,
    /** The cron expression could not be parsed or never fires again. */
    INVALID_EXPRESSION
  }

  /**
   * Next execution time.
   *
   * @param at when the next execution is due (strictly after the last run)
   */
  record Next(Instant at) implements RecurrencePlan {
    public Next {
      Objects.requireNonNull(at, "at");
    }
  }

  /**
   * No more executions.
   */
  record Done(DoneReason reason) implements RecurrencePlan {
    public Done {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
