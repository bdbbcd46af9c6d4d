package io.campaign;

import io.campaign.frequency.FrequencyGuard;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.Delivery;
import io.campaign.model.RecurrencePattern;
import io.campaign.model.RetryEntry;
import io.campaign.model.Schedule;
import io.campaign.model.ScheduleStatus;
import io.campaign.model.Segment;
import io.campaign.model.SegmentFilter;
import io.campaign.recurrence.RecurrencePlanner;
import io.campaign.retry.RetryQueue;
import io.campaign.spi.CampaignStore;
import io.campaign.spi.CampaignStores;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.DeliveryStore;
import io.campaign.spi.SegmentStore;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator control surface: create campaigns and segments, pause, resume and terminate
 * campaigns, review exhausted retries and manage opt-outs.
 *
 * <p>Every state change is a single transaction over conditional updates, so operator actions
 * race safely with a running dispatcher. Pausing takes effect at the next tick boundary.
 */
public final class CampaignOperations {
  private static final Logger logger = Logger.getLogger(CampaignOperations.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignStore campaignStore;
  private final SegmentStore segmentStore;
  private final DeliveryStore deliveryStore;
  private final RetryQueue retryQueue;
  private final FrequencyGuard frequencyGuard;
  private final Clock clock;

  public CampaignOperations(ConnectionProvider connectionProvider, CampaignStores stores,
      RetryQueue retryQueue, FrequencyGuard frequencyGuard, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    Objects.requireNonNull(stores, "stores");
    this.campaignStore = stores.campaigns();
    this.segmentStore = stores.segments();
    this.deliveryStore = stores.deliveries();
    this.retryQueue = Objects.requireNonNull(retryQueue, "retryQueue");
    this.frequencyGuard = Objects.requireNonNull(frequencyGuard, "frequencyGuard");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates an active campaign together with its first schedule.
   *
   * @throws IllegalArgumentException if the cron expression is malformed or the segment is unknown
   */
  public Campaign createCampaign(CampaignDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    if (definition.recurrence().pattern() == RecurrencePattern.CUSTOM
        && !RecurrencePlanner.isValidCron(definition.recurrence().cronExpression())) {
      throw new IllegalArgumentException("Invalid cron expression: " + definition.recurrence().cronExpression());
    }
    Instant now = now();
    Campaign campaign = new Campaign(UUID.randomUUID().toString(), definition.title(), definition.content(),
        definition.segmentId(), definition.recurrence(), CampaignStatus.ACTIVE, now, now);
    Instant firstRun = definition.startAt() != null ? definition.startAt().truncatedTo(ChronoUnit.MILLIS) : now;
    Schedule schedule = new Schedule(UUID.randomUUID().toString(), campaign.campaignId(), firstRun,
        ScheduleStatus.SCHEDULED, definition.executionOrder(), 0, false, null, null, null, null, now);
    connectionProvider.inTransaction(conn -> {
      if (definition.segmentId() != null && segmentStore.find(conn, definition.segmentId()).isEmpty()) {
        throw new IllegalArgumentException("Unknown segment: " + definition.segmentId());
      }
      campaignStore.insertCampaign(conn, campaign);
      campaignStore.insertSchedule(conn, schedule);
      return null;
    });
    logger.log(Level.INFO, "Created campaign {0} ({1}), first run at {2}",
        new Object[] {campaign.campaignId(), definition.recurrence().pattern().code(), firstRun});
    return campaign;
  }

  public Segment createSegment(String name, String description, SegmentFilter filter) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(filter, "filter");
    Segment segment = new Segment(UUID.randomUUID().toString(), name, description, filter, now());
    connectionProvider.withConnection(conn -> {
      segmentStore.insert(conn, segment);
      return null;
    });
    return segment;
  }

  public List<Segment> segments() {
    return connectionProvider.withConnection(segmentStore::findAll);
  }

  public Optional<Campaign> campaign(String campaignId) {
    return connectionProvider.withConnection(conn -> campaignStore.findCampaign(conn, campaignId));
  }

  public Optional<Schedule> schedule(String campaignId) {
    return connectionProvider.withConnection(conn -> campaignStore.findScheduleByCampaign(conn, campaignId));
  }

  public List<Delivery> deliveries(String campaignId, int limit) {
    return connectionProvider.withConnection(conn -> deliveryStore.findByCampaign(conn, campaignId, limit));
  }

  /**
   * Pauses an active campaign. A schedule that is executing finishes its current run and
   * then stays paused.
   *
   * @throws IllegalStateException if the campaign is unknown, not active, or its schedule is terminal
   */
  public void pauseCampaign(String campaignId) {
    Instant now = now();
    connectionProvider.inTransaction(conn -> {
      Schedule schedule = requireSchedule(conn, campaignId);
      if (schedule.status().isTerminal()) {
        throw new IllegalStateException("Cannot pause campaign " + campaignId
            + ": schedule is " + schedule.status());
      }
      if (campaignStore.updateCampaignStatus(conn, campaignId, EnumSet.of(CampaignStatus.ACTIVE),
          CampaignStatus.PAUSED, now) == 0) {
        throw new IllegalStateException("Cannot pause campaign " + campaignId + ": it is not active");
      }
      if (campaignStore.pause(conn, schedule.scheduleId(), now) == 0) {
        throw new IllegalStateException("Cannot pause campaign " + campaignId
            + ": schedule changed concurrently");
      }
      return null;
    });
    logger.log(Level.INFO, "Paused campaign {0}", campaignId);
  }

  /**
   * Resumes a paused campaign, returning its schedule to {@code SCHEDULED}.
   *
   * @throws IllegalStateException if the campaign is unknown or not paused
   */
  public void resumeCampaign(String campaignId) {
    Instant now = now();
    connectionProvider.inTransaction(conn -> {
      Schedule schedule = requireSchedule(conn, campaignId);
      if (campaignStore.updateCampaignStatus(conn, campaignId, EnumSet.of(CampaignStatus.PAUSED),
          CampaignStatus.ACTIVE, now) == 0) {
        throw new IllegalStateException("Cannot resume campaign " + campaignId + ": it is not paused");
      }
      if (campaignStore.resume(conn, schedule.scheduleId(), now) == 0) {
        throw new IllegalStateException("Cannot resume campaign " + campaignId
            + ": schedule is " + schedule.status());
      }
      return null;
    });
    logger.log(Level.INFO, "Resumed campaign {0}", campaignId);
  }

  /**
   * Stops a campaign for good. Its schedule fails with {@code reason} and pending retries are
   * no longer drained.
   *
   * @throws IllegalStateException if the campaign is unknown or already finished
   */
  public void terminateCampaign(String campaignId, String reason) {
    Instant now = now();
    String effectiveReason = reason != null ? reason : "terminated by operator";
    connectionProvider.inTransaction(conn -> {
      Schedule schedule = requireSchedule(conn, campaignId);
      if (campaignStore.updateCampaignStatus(conn, campaignId,
          EnumSet.of(CampaignStatus.ACTIVE, CampaignStatus.PAUSED), CampaignStatus.TERMINATED, now) == 0) {
        throw new IllegalStateException("Cannot terminate campaign " + campaignId + ": it already finished");
      }
      campaignStore.terminate(conn, schedule.scheduleId(), effectiveReason, now);
      return null;
    });
    logger.log(Level.INFO, "Terminated campaign {0}: {1}", new Object[] {campaignId, effectiveReason});
  }

  /**
   * Retry entries of a campaign that ran out of attempts, for operator review.
   */
  public List<RetryEntry> exhaustedRetries(String campaignId, int limit) {
    return retryQueue.exhaustedEntries(campaignId, limit);
  }

  /**
   * Sets or clears a recipient's opt-out flag.
   *
   * @return {@code false} if the recipient is unknown
   */
  public boolean setOptOut(String recipientId, boolean optedOut, String reason) {
    return frequencyGuard.setOptOut(recipientId, optedOut, reason, now());
  }

  private Schedule requireSchedule(Connection conn, String campaignId) {
    if (campaignStore.findCampaign(conn, campaignId).isEmpty()) {
      throw new IllegalStateException("Unknown campaign: " + campaignId);
    }
    return campaignStore.findScheduleByCampaign(conn, campaignId)
        .orElseThrow(() -> new IllegalStateException("Campaign " + campaignId + " has no schedule"));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }
}
