package io.campaign;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown by a {@link SendCollaborator} when the provider rate-limited the send and named a
 * minimum wait, for collaborators that prefer throwing over returning
 * {@link SendOutcome#failure(SendError)}.
 *
 * <p>The send is classified {@link io.campaign.model.ErrorClass#RATE_LIMITED}. The wait is a
 * floor on the backoff delay, never a replacement for it, and the attempt still counts
 * against the retry entry's maximum.
 *
 * @see SendError#retryAfterSeconds()
 */
public class RetryAfterException extends RuntimeException {

  private final Duration retryAfter;

  /**
   * @throws NullPointerException     if {@code retryAfter} is null
   * @throws IllegalArgumentException if {@code retryAfter} is negative
   */
  public RetryAfterException(Duration retryAfter) {
    this(retryAfter, null);
  }

  /**
   * @param message provider detail; defaults to {@code "Retry after <duration>"} when null
   */
  public RetryAfterException(Duration retryAfter, String message) {
    super(message != null ? message : "Retry after " + checked(retryAfter));
    this.retryAfter = checked(retryAfter);
  }

  public Duration retryAfter() {
    return retryAfter;
  }

  /**
   * The wait rounded up to whole seconds, the unit retry hints are stored in.
   */
  public long retryAfterSeconds() {
    long millis = retryAfter.toMillis();
    return (millis + 999) / 1000;
  }

  private static Duration checked(Duration retryAfter) {
    Objects.requireNonNull(retryAfter, "retryAfter");
    if (retryAfter.isNegative()) {
      throw new IllegalArgumentException("retryAfter must not be negative: " + retryAfter);
    }
    return retryAfter;
  }
}
