/**
 * Recurrence planning: next run time from a pattern, the last run and the rule's bounds.
 */
package io.campaign.recurrence;
