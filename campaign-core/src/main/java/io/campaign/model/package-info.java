/**
 * Domain model of the campaign engine: campaigns and their rolling schedule, deliveries,
 * retry queue entries, segments, engagement events and A/B tests, plus their status enums.
 */
package io.campaign.model;
