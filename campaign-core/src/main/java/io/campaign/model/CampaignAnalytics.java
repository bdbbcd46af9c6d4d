package io.campaign.model;

/**
 * Aggregated delivery and engagement counts of one campaign.
 *
 * @param sent sent delivery rows, one per recipient and occurrence
 * @param sentRecipients distinct recipients with at least one sent delivery
 * @param engagedRecipients distinct sent recipients that opened, clicked or replied
 */
public record CampaignAnalytics(
    String campaignId,
    long sent,
    long failed,
    long blocked,
    long opened,
    long clicked,
    long replied,
    long shared,
    long sentRecipients,
    long engagedRecipients
) {

  public long totalRecipients() {
    return sent + failed + blocked;
  }

  public double deliveryRate() {
    long total = totalRecipients();
    return total == 0 ? 0.0 : (double) sent / total;
  }

  public double engagementRate() {
    return sentRecipients == 0 ? 0.0 : (double) engagedRecipients / sentRecipients;
  }
}
