package io.campaign.recurrence;

import io.campaign.model.RecurrencePattern;
import io.campaign.model.RecurrenceRule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class RecurrencePlannerTest {

  private final RecurrencePlanner planner = new RecurrencePlanner();

  @Test
  void dailyWithMaxOccurrencesStopsAfterThirdRun() {
    RecurrenceRule rule = RecurrenceRule.of(RecurrencePattern.DAILY).limitedTo(3);
    Instant day1 = Instant.parse("2024-03-01T09:00:00Z");

    RecurrencePlan afterFirst = planner.next(rule, day1, 1);
    assertEquals(RecurrencePlan.next(Instant.parse("2024-03-02T09:00:00Z")), afterFirst);

    Instant day2 = ((RecurrencePlan.Next) afterFirst).at();
    RecurrencePlan afterSecond = planner.next(rule, day2, 2);
    assertEquals(RecurrencePlan.next(Instant.parse("2024-03-03T09:00:00Z")), afterSecond);

    Instant day3 = ((RecurrencePlan.Next) afterSecond).at();
    RecurrencePlan afterThird = planner.next(rule, day3, 3);
    assertTrue(afterThird.isDone());
    assertEquals(RecurrencePlan.DoneReason.MAX_OCCURRENCES_REACHED, ((RecurrencePlan.Done) afterThird).reason());
  }

  @Test
  void weeklyAddsSevenDays() {
    RecurrencePlan plan = planner.next(RecurrenceRule.of(RecurrencePattern.WEEKLY),
        Instant.parse("2024-03-01T09:00:00Z"), 1);

    assertEquals(RecurrencePlan.next(Instant.parse("2024-03-08T09:00:00Z")), plan);
  }

  @Test
  void monthlyClampsToLastDayOfShorterMonth() {
    RecurrenceRule rule = RecurrenceRule.of(RecurrencePattern.MONTHLY);

    assertEquals(RecurrencePlan.next(Instant.parse("2024-02-29T10:00:00Z")),
        planner.next(rule, Instant.parse("2024-01-31T10:00:00Z"), 1));
    assertEquals(RecurrencePlan.next(Instant.parse("2023-02-28T10:00:00Z")),
        planner.next(rule, Instant.parse("2023-01-31T10:00:00Z"), 1));
    assertEquals(RecurrencePlan.next(Instant.parse("2024-03-29T10:00:00Z")),
        planner.next(rule, Instant.parse("2024-02-29T10:00:00Z"), 2));
  }

  @Test
  void monthlyFollowsLocalTimeInConfiguredZone() {
    RecurrencePlanner berlin = new RecurrencePlanner(ZoneId.of("Europe/Berlin"));

    // 09:00 local in winter (UTC+1) stays 09:00 local in summer (UTC+2)
    RecurrencePlan plan = berlin.next(RecurrenceRule.of(RecurrencePattern.MONTHLY),
        Instant.parse("2024-03-15T08:00:00Z"), 1);

    assertEquals(RecurrencePlan.next(Instant.parse("2024-04-15T07:00:00Z")), plan);
  }

  @Test
  void customCronUsesFirstFireTimeAfterLastRun() {
    RecurrenceRule rule = RecurrenceRule.cron("0 9 * * MON");

    // 2024-03-04 is a Monday
    RecurrencePlan plan = planner.next(rule, Instant.parse("2024-03-04T09:00:00Z"), 1);

    assertEquals(RecurrencePlan.next(Instant.parse("2024-03-11T09:00:00Z")), plan);
  }

  @Test
  void sixFieldCronIsAccepted() {
    RecurrencePlan plan = planner.next(RecurrenceRule.cron("30 0 12 * * *"),
        Instant.parse("2024-03-04T13:00:00Z"), 1);

    assertEquals(RecurrencePlan.next(Instant.parse("2024-03-05T12:00:30Z")), plan);
  }

  @Test
  void invalidCronIsTerminal() {
    RecurrencePlan plan = planner.next(RecurrenceRule.cron("not a cron"),
        Instant.parse("2024-03-04T09:00:00Z"), 1);

    assertEquals(RecurrencePlan.done(RecurrencePlan.DoneReason.INVALID_EXPRESSION), plan);
    assertFalse(RecurrencePlanner.isValidCron("not a cron"));
    assertFalse(RecurrencePlanner.isValidCron("  "));
    assertTrue(RecurrencePlanner.isValidCron("*/15 * * * *"));
  }

  @Test
  void nextRunAfterEndDateIsTerminal() {
    RecurrenceRule rule = RecurrenceRule.of(RecurrencePattern.DAILY)
        .endingAt(Instant.parse("2024-03-02T08:59:59Z"));

    RecurrencePlan plan = planner.next(rule, Instant.parse("2024-03-01T09:00:00Z"), 1);

    assertEquals(RecurrencePlan.done(RecurrencePlan.DoneReason.END_DATE_PASSED), plan);
  }

  @Test
  void nextRunExactlyAtEndDateIsAllowed() {
    RecurrenceRule rule = RecurrenceRule.of(RecurrencePattern.DAILY)
        .endingAt(Instant.parse("2024-03-02T09:00:00Z"));

    RecurrencePlan plan = planner.next(rule, Instant.parse("2024-03-01T09:00:00Z"), 1);

    assertEquals(RecurrencePlan.next(Instant.parse("2024-03-02T09:00:00Z")), plan);
  }

  @Test
  void nonRecurringIsTerminal() {
    RecurrencePlan plan = planner.next(RecurrenceRule.once(), Instant.parse("2024-03-01T09:00:00Z"), 1);

    assertEquals(RecurrencePlan.done(RecurrencePlan.DoneReason.NOT_RECURRING), plan);
  }

  @Test
  void planIsStrictlyIncreasing() {
    RecurrenceRule[] rules = {
        RecurrenceRule.of(RecurrencePattern.DAILY),
        RecurrenceRule.of(RecurrencePattern.WEEKLY),
        RecurrenceRule.of(RecurrencePattern.MONTHLY),
        RecurrenceRule.cron("0 */6 * * *")
    };
    for (RecurrenceRule rule : rules) {
      Instant last = Instant.parse("2024-01-31T23:30:00Z");
      for (int count = 1; count <= 24; count++) {
        RecurrencePlan plan = planner.next(rule, last, count);
        Instant next = assertInstanceOf(RecurrencePlan.Next.class, plan).at();
        assertTrue(next.isAfter(last), rule.pattern() + " went from " + last + " to " + next);
        last = next;
      }
    }
  }

  @Test
  void customRuleRequiresExpression() {
    assertThrows(IllegalArgumentException.class,
        () -> new RecurrenceRule(RecurrencePattern.CUSTOM, " ", null, null));
    assertThrows(IllegalArgumentException.class,
        () -> RecurrenceRule.of(RecurrencePattern.DAILY).limitedTo(0));
  }
}
