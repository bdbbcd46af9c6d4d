package io.campaign.frequency;

import java.util.Locale;

/**
 * Verdict of the {@link FrequencyGuard} for one recipient.
 */
public enum Eligibility {
  ELIGIBLE,
  OPTED_OUT,
  FREQUENCY_CAPPED;

  public boolean isEligible() {
    return this == ELIGIBLE;
  }

  /** Lower-case name used as a metric tag. */
  public String reason() {
    return name().toLowerCase(Locale.ROOT);
  }
}
