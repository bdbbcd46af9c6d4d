package io.campaign.retry;

import io.campaign.model.ErrorClass;

import java.time.Duration;

/**
 * Geometric backoff with a separate starting delay per error class.
 *
 * <p>Delay formula: {@code initialDelay(errorClass) * multiplier^(attempt-1)}, capped at
 * {@code maxDelay}. Rate-limited failures start from a longer initial delay than transient
 * ones. There is no jitter, so delays never decrease from one attempt to the next.
 */
public final class GeometricBackoffPolicy implements BackoffPolicy {
  public static final Duration DEFAULT_TRANSIENT_DELAY = Duration.ofSeconds(60);
  public static final Duration DEFAULT_RATE_LIMITED_DELAY = Duration.ofMinutes(15);
  public static final double DEFAULT_MULTIPLIER = 2.0;
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofHours(24);

  private final long transientDelayMs;
  private final long rateLimitedDelayMs;
  private final double multiplier;
  private final long maxDelayMs;

  /**
   * @param transientDelay   delay after the first transient failure
   * @param rateLimitedDelay delay after the first rate-limited failure
   * @param multiplier       growth factor per attempt, at least {@code 1.0}
   * @param maxDelay         cap on any computed delay
   */
  public GeometricBackoffPolicy(Duration transientDelay, Duration rateLimitedDelay, double multiplier, Duration maxDelay) {
    this.transientDelayMs = positiveMillis(transientDelay, "transientDelay");
    this.rateLimitedDelayMs = positiveMillis(rateLimitedDelay, "rateLimitedDelay");
    this.maxDelayMs = positiveMillis(maxDelay, "maxDelay");
    if (Double.isNaN(multiplier) || multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1.0, got: " + multiplier);
    }
    this.multiplier = multiplier;
  }

  public static GeometricBackoffPolicy defaults() {
    return new GeometricBackoffPolicy(DEFAULT_TRANSIENT_DELAY, DEFAULT_RATE_LIMITED_DELAY,
        DEFAULT_MULTIPLIER, DEFAULT_MAX_DELAY);
  }

  @Override
  public long computeDelayMs(ErrorClass errorClass, int attempt) {
    if (attempt <= 0) {
      return 0L;
    }
    long initial = errorClass == ErrorClass.RATE_LIMITED ? rateLimitedDelayMs : transientDelayMs;
    double delay = initial * Math.pow(multiplier, attempt - 1);
    // pow overflows to Infinity for large attempts; the cap absorbs it
    if (Double.isInfinite(delay) || delay >= maxDelayMs) {
      return maxDelayMs;
    }
    return (long) delay;
  }

  private static long positiveMillis(Duration duration, String name) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + duration);
    }
    return duration.toMillis();
  }
}
