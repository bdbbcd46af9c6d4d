package io.campaign.model;

/**
 * Sent and engaged recipient counts for one A/B arm. Both count distinct recipients.
 */
public record VariantStats(Variant variant, long sent, long engaged) {

  /** Engaged over sent, or {@code 0} when nothing was sent. */
  public double engagementRate() {
    return sent == 0 ? 0.0 : (double) engaged / sent;
  }
}
