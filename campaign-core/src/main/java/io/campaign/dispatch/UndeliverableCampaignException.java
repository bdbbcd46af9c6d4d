package io.campaign.dispatch;

/**
 * Thrown when a campaign cannot be delivered at all, for example because its segment no
 * longer exists. The schedule is marked {@code FAILED} instead of being retried.
 */
public class UndeliverableCampaignException extends RuntimeException {

  public UndeliverableCampaignException(String message) {
    super(message);
  }
}
