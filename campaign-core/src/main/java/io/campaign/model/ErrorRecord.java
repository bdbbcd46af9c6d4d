package io.campaign.model;

import java.time.Instant;

/**
 * One failed attempt in a retry entry's error history.
 */
public record ErrorRecord(Instant timestamp, int attempt, String code, String message) {}
