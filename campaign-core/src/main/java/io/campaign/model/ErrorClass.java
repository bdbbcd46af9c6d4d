package io.campaign.model;

/**
 * Classification of a failed send, deciding whether and how it is retried.
 */
public enum ErrorClass {
  /** Never retried; recorded as a failed or blocked delivery. */
  PERMANENT,
  /** Network errors and 5xx responses; retried on the standard ladder. */
  TRANSIENT,
  /** HTTP 429; retried on the longer ladder, honoring any provider retry-after hint. */
  RATE_LIMITED;

  public boolean isRetryable() {
    return this != PERMANENT;
  }
}
