package io.campaign.spi;

import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.Schedule;
import io.campaign.model.ScheduleStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for campaigns and their rolling schedule.
 *
 * <p>Every state transition is a conditional update returning the number of rows changed;
 * {@code 0} means another writer got there first or the row was not in an allowed state.
 * All methods operate on a caller-supplied connection and do not commit.
 */
public interface CampaignStore {

  void insertCampaign(Connection conn, Campaign campaign);

  Optional<Campaign> findCampaign(Connection conn, String campaignId);

  /**
   * Moves a campaign to {@code newStatus} if it is currently in one of {@code expected}.
   */
  int updateCampaignStatus(Connection conn, String campaignId, Set<CampaignStatus> expected,
      CampaignStatus newStatus, Instant now);

  void insertSchedule(Connection conn, Schedule schedule);

  Optional<Schedule> findSchedule(Connection conn, String scheduleId);

  Optional<Schedule> findScheduleByCampaign(Connection conn, String campaignId);

  /**
   * Returns claimable schedules of active campaigns: {@code SCHEDULED} and due, or
   * {@code EXECUTING} with a claim older than {@code lockExpiry}. Ordered by execution order,
   * then due time.
   */
  List<Schedule> pollDue(Connection conn, Instant now, Instant lockExpiry, int limit);

  /**
   * Atomically transitions a claimable schedule to {@code EXECUTING} owned by {@code ownerId}
   * and increments its execution count.
   *
   * @return {@code 1} if this caller won the claim, {@code 0} otherwise
   */
  int claim(Connection conn, String scheduleId, String ownerId, Instant now, Instant lockExpiry);

  /**
   * Returns an {@code EXECUTING} schedule owned by {@code ownerId} to {@code SCHEDULED} (or
   * {@code PAUSED} when a pause was requested meanwhile) with a new due time.
   */
  int reschedule(Connection conn, String scheduleId, String ownerId, Instant nextAt, Instant now);

  /**
   * Ends the execution owned by {@code ownerId}, moving the schedule to {@code status}
   * ({@code COMPLETED}, {@code FAILED} or {@code DRAINING}).
   */
  int finish(Connection conn, String scheduleId, String ownerId, ScheduleStatus status,
      String error, Instant now);

  /**
   * Pauses a schedule: {@code SCHEDULED -> PAUSED}, or sets the pause marker on an
   * {@code EXECUTING} / {@code DRAINING} schedule.
   */
  int pause(Connection conn, String scheduleId, Instant now);

  /**
   * Resumes a schedule: {@code PAUSED -> SCHEDULED}, or clears the pause marker of a running one.
   */
  int resume(Connection conn, String scheduleId, Instant now);

  /**
   * Moves a schedule from {@code DRAINING} to {@code COMPLETED}.
   */
  int completeDrained(Connection conn, String scheduleId, Instant now);

  /**
   * Stops a non-terminal schedule for good ({@code -> FAILED} with the given reason).
   */
  int terminate(Connection conn, String scheduleId, String reason, Instant now);

  List<Schedule> findDraining(Connection conn, int limit);
}
