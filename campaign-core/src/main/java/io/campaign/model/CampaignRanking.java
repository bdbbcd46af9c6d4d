package io.campaign.model;

/**
 * Row of the top-performing campaigns report.
 */
public record CampaignRanking(String campaignId, String title, long sentRecipients, long engagedRecipients) {

  public double engagementRate() {
    return sentRecipients == 0 ? 0.0 : (double) engagedRecipients / sentRecipients;
  }
}
