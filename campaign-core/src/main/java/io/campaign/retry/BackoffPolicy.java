package io.campaign.retry;

import io.campaign.model.ErrorClass;

/**
 * Strategy for computing the delay before the next retry of a failed send.
 *
 * @see GeometricBackoffPolicy
 */
public interface BackoffPolicy {

  /**
   * Computes the delay before the retry that follows the given failure.
   *
   * @param errorClass classification of the failure ({@code TRANSIENT} or {@code RATE_LIMITED})
   * @param attempt    number of failures recorded so far (1-based)
   * @return delay in milliseconds, never negative and non-decreasing in {@code attempt}
   */
  long computeDelayMs(ErrorClass errorClass, int attempt);
}
