package io.campaign.dispatch;

/**
 * Per-process registry of schedules currently being executed, consulted before the durable
 * claim so that overlapping work in the same process backs off early.
 *
 * <p>This is an optimization only: the conditional claim in the store decides ownership.
 */
public interface InFlightTracker {
  boolean tryAcquire(String scheduleId);

  void release(String scheduleId);
}
