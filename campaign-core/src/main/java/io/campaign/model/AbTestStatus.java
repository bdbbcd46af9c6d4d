package io.campaign.model;

public enum AbTestStatus {
  ACTIVE(0),
  COMPLETED(1);

  private final int code;

  AbTestStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static AbTestStatus fromCode(int code) {
    for (AbTestStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown A/B test status code: " + code);
  }
}
