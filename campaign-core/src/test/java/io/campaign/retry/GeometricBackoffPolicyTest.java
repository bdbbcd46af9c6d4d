package io.campaign.retry;

import io.campaign.model.ErrorClass;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class GeometricBackoffPolicyTest {

  private final GeometricBackoffPolicy policy = GeometricBackoffPolicy.defaults();

  @Test
  void transientLadderDoublesFromSixtySeconds() {
    assertEquals(60_000L, policy.computeDelayMs(ErrorClass.TRANSIENT, 1));
    assertEquals(120_000L, policy.computeDelayMs(ErrorClass.TRANSIENT, 2));
    assertEquals(240_000L, policy.computeDelayMs(ErrorClass.TRANSIENT, 3));
  }

  @Test
  void rateLimitedLadderStartsAtFifteenMinutes() {
    assertEquals(900_000L, policy.computeDelayMs(ErrorClass.RATE_LIMITED, 1));
    assertEquals(1_800_000L, policy.computeDelayMs(ErrorClass.RATE_LIMITED, 2));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    assertEquals(Duration.ofHours(24).toMillis(), policy.computeDelayMs(ErrorClass.TRANSIENT, 30));
    assertEquals(Duration.ofHours(24).toMillis(), policy.computeDelayMs(ErrorClass.RATE_LIMITED, 5000));
  }

  @Test
  void delaysNeverDecrease() {
    long previous = 0;
    for (int attempt = 1; attempt <= 40; attempt++) {
      long delay = policy.computeDelayMs(ErrorClass.TRANSIENT, attempt);
      assertTrue(delay >= previous, "attempt " + attempt + " gave " + delay + " after " + previous);
      previous = delay;
    }
  }

  @Test
  void nonPositiveAttemptHasNoDelay() {
    assertEquals(0L, policy.computeDelayMs(ErrorClass.TRANSIENT, 0));
  }

  @Test
  void rejectsInvalidConfiguration() {
    assertThrows(IllegalArgumentException.class,
        () -> new GeometricBackoffPolicy(Duration.ZERO, Duration.ofMinutes(1), 2.0, Duration.ofHours(1)));
    assertThrows(IllegalArgumentException.class,
        () -> new GeometricBackoffPolicy(Duration.ofSeconds(1), Duration.ofMinutes(1), 0.5, Duration.ofHours(1)));
    assertThrows(IllegalArgumentException.class,
        () -> new GeometricBackoffPolicy(Duration.ofSeconds(1), null, 2.0, Duration.ofHours(1)));
  }
}
