package io.campaign.dispatch;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class DefaultInFlightTrackerTest {
  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  void acquireFailsForScheduleAlreadyInFlight() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker(Duration.ofMinutes(10));

    assertTrue(tracker.tryAcquire("schedule-1"));
    assertFalse(tracker.tryAcquire("schedule-1"));
    assertTrue(tracker.tryAcquire("schedule-2"));
  }

  @Test
  void releaseAllowsReacquisition() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker(Duration.ofMinutes(10));

    assertTrue(tracker.tryAcquire("schedule-1"));
    tracker.release("schedule-1");
    assertTrue(tracker.tryAcquire("schedule-1"));
  }

  @Test
  void releaseOfUnknownScheduleIsNoOp() {
    DefaultInFlightTracker tracker = new DefaultInFlightTracker(Duration.ofMinutes(10));

    tracker.release("never-acquired");
    assertTrue(tracker.tryAcquire("never-acquired"));
  }

  @Test
  void staleEntryCanBeTakenOver() {
    SwitchingClock clock = new SwitchingClock(Clock.fixed(T0, ZoneOffset.UTC),
        Clock.fixed(T0.plus(Duration.ofMinutes(11)), ZoneOffset.UTC));
    DefaultInFlightTracker tracker = new DefaultInFlightTracker(Duration.ofMinutes(10), clock);
    assertTrue(tracker.tryAcquire("schedule-1"));
    assertFalse(tracker.tryAcquire("schedule-1"));

    clock.switchOver();

    assertTrue(tracker.tryAcquire("schedule-1"));
    assertFalse(tracker.tryAcquire("schedule-1"));
  }

  @Test
  void evictExpiredDropsOldEntries() {
    SwitchingClock clock = new SwitchingClock(Clock.fixed(T0, ZoneOffset.UTC),
        Clock.fixed(T0.plus(Duration.ofMinutes(11)), ZoneOffset.UTC));
    DefaultInFlightTracker tracker = new DefaultInFlightTracker(Duration.ofMinutes(10), clock);
    tracker.tryAcquire("schedule-1");
    tracker.tryAcquire("schedule-2");
    assertEquals(2, tracker.size());

    clock.switchOver();
    tracker.evictExpired();

    assertEquals(0, tracker.size());
  }

  @Test
  void rejectsNonPositiveTtl() {
    assertThrows(IllegalArgumentException.class, () -> new DefaultInFlightTracker(Duration.ZERO));
    assertThrows(NullPointerException.class, () -> new DefaultInFlightTracker(null));
  }

  private static final class SwitchingClock extends Clock {
    private final Clock first;
    private final Clock second;
    private boolean switched;

    SwitchingClock(Clock first, Clock second) {
      this.first = first;
      this.second = second;
    }

    void switchOver() {
      switched = true;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return switched ? second.instant() : first.instant();
    }
  }
}
