/**
 * Scheduled campaign delivery with durable retries.
 *
 * <p>{@link io.campaign.CampaignEngine} is the entry point; the transport is plugged in through
 * {@link io.campaign.SendCollaborator}, persistence through the {@link io.campaign.spi} stores.
 */
package io.campaign;
