package io.campaign.model;

import java.util.Locale;

/**
 * How a campaign repeats after its first execution.
 */
public enum RecurrencePattern {
  NONE("none"),
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly"),
  CUSTOM("custom");

  private final String code;

  RecurrencePattern(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public boolean isRecurring() {
    return this != NONE;
  }

  public static RecurrencePattern fromCode(String code) {
    if (code == null) {
      return NONE;
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (RecurrencePattern pattern : values()) {
      if (pattern.code.equals(normalized)) {
        return pattern;
      }
    }
    throw new IllegalArgumentException("Unknown recurrence pattern: " + code);
  }
}
