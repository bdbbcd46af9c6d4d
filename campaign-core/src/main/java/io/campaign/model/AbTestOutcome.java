package io.campaign.model;

import java.util.Locale;

/**
 * Result of comparing the engagement rates of two A/B variants.
 */
public enum AbTestOutcome {
  VARIANT_A,
  VARIANT_B,
  NO_SIGNIFICANT_DIFFERENCE,
  INSUFFICIENT_DATA;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AbTestOutcome fromCode(String code) {
    if (code == null) {
      return null;
    }
    return valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
