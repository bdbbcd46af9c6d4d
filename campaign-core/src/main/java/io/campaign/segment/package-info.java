/**
 * Segment resolution: declarative filters to bounded, paginated recipient id lists.
 */
package io.campaign.segment;
