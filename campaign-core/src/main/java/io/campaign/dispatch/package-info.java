/**
 * Poll loops of the engine: {@link io.campaign.dispatch.ScheduleDispatcher} executes due
 * schedules under a durable claim, {@link io.campaign.dispatch.RetryDrainer} drains the retry
 * queue on its own cadence. Send failures are classified by a
 * {@link io.campaign.dispatch.FailureClassifier}.
 */
package io.campaign.dispatch;
