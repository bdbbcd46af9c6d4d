package io.campaign.model;

public enum DeliveryStatus {
  SENT(0),
  FAILED(1),
  BLOCKED(2);

  private final int code;

  DeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }
}
