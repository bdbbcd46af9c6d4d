package io.campaign.model;

import java.util.Locale;

public enum EngagementType {
  OPENED("opened"),
  CLICKED("clicked"),
  REPLIED("replied"),
  SHARED("shared");

  private final String code;

  EngagementType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /** Whether the event makes its recipient count as engaged. Sharing does not. */
  public boolean isEngagement() {
    return this != SHARED;
  }

  public static EngagementType fromCode(String code) {
    String normalized = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
    for (EngagementType type : values()) {
      if (type.code.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown engagement type: " + code);
  }
}
