package io.campaign.model;

/**
 * Delivery preferences and weekly counter of one recipient.
 *
 * @param maxSendsPerWeek per-recipient cap, or {@code null} to use the configured default
 */
public record RecipientPreferences(
    String recipientId,
    boolean optedOut,
    int sendsThisWeek,
    Integer maxSendsPerWeek
) {}
