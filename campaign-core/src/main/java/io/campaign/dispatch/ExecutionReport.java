package io.campaign.dispatch;

/**
 * Per-recipient tally of one schedule execution.
 *
 * @param resolved   recipients returned by the segment
 * @param sent       delivered on the first attempt
 * @param failed     permanently failed
 * @param blocked    refused by the recipient
 * @param retrying   handed to the retry queue
 * @param suppressed skipped by opt-out or frequency cap
 * @param duplicates skipped because this occurrence was already delivered or a retry is pending
 * @param errors     abandoned because recording the outcome threw
 */
public record ExecutionReport(
    int resolved,
    int sent,
    int failed,
    int blocked,
    int retrying,
    int suppressed,
    int duplicates,
    int errors
) {}
