/**
 * Dialect-specific retry queue stores and their {@link java.util.ServiceLoader} registry.
 */
package io.campaign.jdbc.retry;
