package io.campaign.model;

import java.time.Instant;
import java.util.List;

/**
 * Read-only record of a retry queue row. One row exists per {@code (campaignId, recipientId)}.
 *
 * @param attempt      number of failed sends recorded so far
 * @param delayMs      backoff delay applied when {@code nextRetryAt} was computed
 * @param errorHistory failures in the order they happened
 */
public record RetryEntry(
    String entryId,
    String campaignId,
    String scheduleId,
    int occurrence,
    String recipientId,
    Variant variant,
    int attempt,
    int maxAttempts,
    long delayMs,
    ErrorClass errorClass,
    String lastErrorCode,
    String lastErrorMessage,
    List<ErrorRecord> errorHistory,
    Instant nextRetryAt,
    RetryStatus status,
    Instant createdAt,
    Instant updatedAt
) {
  public RetryEntry {
    errorHistory = errorHistory == null ? List.of() : List.copyOf(errorHistory);
  }

  public boolean isPending() {
    return status == RetryStatus.PENDING;
  }
}
