/**
 * Micrometer bridge for engine metrics.
 */
package io.campaign.micrometer;
