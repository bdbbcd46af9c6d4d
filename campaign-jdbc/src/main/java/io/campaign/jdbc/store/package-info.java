/**
 * Portable JDBC implementations of the campaign, delivery, segment, recipient, engagement and
 * A/B test stores.
 */
package io.campaign.jdbc.store;
