/**
 * Engagement tracking, per-campaign analytics and A/B winner selection.
 */
package io.campaign.analytics;
