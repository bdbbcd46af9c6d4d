/**
 * Spring Boot auto-configuration for the campaign engine.
 *
 * <p>Applications provide a {@code DataSource} and a {@link io.campaign.SendCollaborator}
 * bean; the starter contributes the stores, the {@link io.campaign.CampaignEngine} and its
 * operator facades, tuned through {@code campaign.*} properties.
 */
package io.campaign.spring.boot;
