/**
 * Retry queue with geometric backoff, per-class initial delays and provider retry-after floors.
 */
package io.campaign.retry;
