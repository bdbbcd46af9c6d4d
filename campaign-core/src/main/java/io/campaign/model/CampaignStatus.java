package io.campaign.model;

public enum CampaignStatus {
  ACTIVE(0),
  PAUSED(1),
  COMPLETED(2),
  FAILED(3),
  TERMINATED(4);

  private final int code;

  CampaignStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == TERMINATED;
  }

  public static CampaignStatus fromCode(int code) {
    for (CampaignStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown campaign status code: " + code);
  }
}
