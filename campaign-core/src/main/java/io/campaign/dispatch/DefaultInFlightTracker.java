package io.campaign.dispatch;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker whose entries expire after a TTL, so a
 * schedule stuck in a dead thread does not stay blocked for the life of the process.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<String, Long> inFlight = new ConcurrentHashMap<>();
  private final long ttlMs;
  private final Clock clock;

  /**
   * @param ttl how long an entry blocks re-acquisition; must be positive
   */
  public DefaultInFlightTracker(Duration ttl) {
    this(ttl, Clock.systemUTC());
  }

  public DefaultInFlightTracker(Duration ttl, Clock clock) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    this.ttlMs = ttl.toMillis();
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean tryAcquire(String scheduleId) {
    long now = clock.millis();
    Long existing = inFlight.putIfAbsent(scheduleId, now);
    if (existing == null) {
      return true;
    }
    // Stale entry: take it over only if nobody else replaced it meanwhile
    return now - existing > ttlMs && inFlight.replace(scheduleId, existing, now);
  }

  @Override
  public void release(String scheduleId) {
    inFlight.remove(scheduleId);
  }

  /**
   * Drops expired entries. Called once per dispatcher tick.
   */
  public void evictExpired() {
    long now = clock.millis();
    inFlight.values().removeIf(acquiredAt -> now - acquiredAt > ttlMs);
  }

  int size() {
    return inFlight.size();
  }
}
