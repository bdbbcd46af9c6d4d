package io.campaign.model;

public enum RetryStatus {
  PENDING(0),
  SUCCEEDED(1),
  FAILED(2);

  private final int code;

  RetryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static RetryStatus fromCode(int code) {
    for (RetryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown retry status code: " + code);
  }
}
