package io.campaign.model;

/**
 * Lifecycle of a {@link Schedule}.
 *
 * <p>{@code SCHEDULED -> EXECUTING -> (SCHEDULED | DRAINING | COMPLETED | FAILED)}, with
 * {@code PAUSED} reachable from {@code SCHEDULED} (directly) or {@code EXECUTING} (once the
 * running execution finishes). {@code DRAINING} is a non-recurring schedule whose fan-out is
 * finished while some recipients still wait in the retry queue.
 */
public enum ScheduleStatus {
  SCHEDULED(0),
  EXECUTING(1),
  COMPLETED(2),
  FAILED(3),
  PAUSED(4),
  DRAINING(5);

  private final int code;

  ScheduleStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public static ScheduleStatus fromCode(int code) {
    for (ScheduleStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown schedule status code: " + code);
  }
}
