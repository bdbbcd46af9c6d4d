package io.campaign.spi;

import java.util.Objects;

/**
 * The set of stores backing one engine instance.
 */
public record CampaignStores(
    CampaignStore campaigns,
    DeliveryStore deliveries,
    RetryQueueStore retries,
    SegmentStore segments,
    RecipientStore recipients,
    EngagementStore engagement,
    AbTestStore abTests
) {
  public CampaignStores {
    Objects.requireNonNull(campaigns, "campaigns");
    Objects.requireNonNull(deliveries, "deliveries");
    Objects.requireNonNull(retries, "retries");
    Objects.requireNonNull(segments, "segments");
    Objects.requireNonNull(recipients, "recipients");
    Objects.requireNonNull(engagement, "engagement");
    Objects.requireNonNull(abTests, "abTests");
  }
}
