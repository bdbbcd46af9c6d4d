/**
 * Service provider interfaces: connection provider, store contracts and metrics export.
 *
 * <p>JDBC implementations live in the {@code campaign-jdbc} module; a Micrometer exporter in
 * {@code campaign-micrometer}.
 */
package io.campaign.spi;
