package io.campaign.model;

/**
 * A/B test arm a recipient was assigned to.
 */
public enum Variant {
  A,
  B
}
