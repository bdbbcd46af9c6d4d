/**
 * Opt-out and weekly frequency cap checks applied to every resolved recipient.
 */
package io.campaign.frequency;
