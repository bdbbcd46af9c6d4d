package io.campaign.jdbc;

import io.campaign.SendError;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.model.Delivery;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.ErrorClass;
import io.campaign.model.RecurrencePattern;
import io.campaign.model.RecurrenceRule;
import io.campaign.model.RetryEntry;
import io.campaign.model.RetryStatus;
import io.campaign.model.Schedule;
import io.campaign.model.ScheduleStatus;
import io.campaign.model.SegmentFilter;
import io.campaign.model.Variant;
import io.campaign.retry.RetryQueue;
import io.campaign.retry.RetryTarget;
import io.campaign.spi.CampaignStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dialect-sensitive store behaviour, run against every supported database.
 */
abstract class AbstractCampaignStoreIntegrationTest {
  static final String[] TABLES = {
      "campaigns", "schedules", "deliveries", "retry_queue", "segments", "recipients",
      "engagement_events", "ab_tests"};

  private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");
  private static final Duration LOCK_TIMEOUT = Duration.ofMinutes(5);
  private static final SendError TIMEOUT = SendError.of("ETIMEDOUT", "socket timeout");

  private CampaignStores stores;
  private DataSourceConnectionProvider connectionProvider;
  private MutableClock clock;
  private RetryQueue retryQueue;

  abstract DataSource dataSource();

  @BeforeEach
  void setUpStores() {
    stores = JdbcCampaignStores.create(dataSource());
    connectionProvider = new DataSourceConnectionProvider(dataSource());
    clock = new MutableClock(T0);
    retryQueue = RetryQueue.builder()
        .connectionProvider(connectionProvider)
        .store(stores.retries())
        .maxAttempts(3)
        .clock(clock)
        .build();
  }

  @Test
  void retryEnqueueKeepsOneRowPerCampaignAndRecipient() {
    insertCampaign("c-1", CampaignStatus.ACTIVE);
    RetryTarget target = new RetryTarget("c-1", "s-c-1", 1, "r-1", Variant.A);

    RetryEntry first = retryQueue.enqueue(target, ErrorClass.TRANSIENT, TIMEOUT);
    clock.advance(Duration.ofSeconds(60));
    RetryEntry second = retryQueue.enqueue(target, ErrorClass.RATE_LIMITED, SendError.rateLimited("slow down", 30));

    assertEquals(first.entryId(), second.entryId());
    RetryEntry stored = connectionProvider.withConnection(
        conn -> stores.retries().find(conn, "c-1", "r-1")).orElseThrow();
    assertEquals(2, stored.attempt());
    assertEquals(Variant.A, stored.variant());
    assertEquals(ErrorClass.RATE_LIMITED, stored.errorClass());
    assertEquals(List.of("ETIMEDOUT", "RATE_LIMITED"),
        stored.errorHistory().stream().map(r -> r.code()).toList());
    assertEquals(T0.plusSeconds(60), stored.errorHistory().get(1).timestamp());
    assertEquals(1, (int) connectionProvider.withConnection(conn -> retryQueue.countPending(conn, "c-1")));
  }

  @Test
  void dueEntriesSkipInactiveCampaignsAndFutureRetries() {
    insertCampaign("c-active", CampaignStatus.ACTIVE);
    insertCampaign("c-paused", CampaignStatus.PAUSED);
    retryQueue.enqueue(new RetryTarget("c-active", "s-c-active", 1, "r-1", null), ErrorClass.TRANSIENT, TIMEOUT);
    retryQueue.enqueue(new RetryTarget("c-paused", "s-c-paused", 1, "r-1", null), ErrorClass.TRANSIENT, TIMEOUT);

    assertTrue(retryQueue.dueEntries(10).isEmpty());

    clock.advance(Duration.ofSeconds(60));
    List<RetryEntry> due = retryQueue.dueEntries(10);
    assertEquals(List.of("c-active"), due.stream().map(RetryEntry::campaignId).toList());
  }

  @Test
  void claimDueHidesEntriesFromOtherOwnersUntilTheLockExpires() {
    insertCampaign("c-1", CampaignStatus.ACTIVE);
    retryQueue.enqueue(new RetryTarget("c-1", "s-c-1", 1, "r-1", null), ErrorClass.TRANSIENT, TIMEOUT);
    retryQueue.enqueue(new RetryTarget("c-1", "s-c-1", 1, "r-2", null), ErrorClass.TRANSIENT, TIMEOUT);
    clock.advance(Duration.ofSeconds(60));

    assertEquals(2, retryQueue.claimDueEntries("node-a", LOCK_TIMEOUT, 10).size());
    assertTrue(retryQueue.claimDueEntries("node-b", LOCK_TIMEOUT, 10).isEmpty());

    clock.advance(LOCK_TIMEOUT.plusSeconds(1));
    assertEquals(2, retryQueue.claimDueEntries("node-b", LOCK_TIMEOUT, 10).size());
  }

  @Test
  void retryOutcomesAreConditionalOnTheAttemptSeen() {
    insertCampaign("c-1", CampaignStatus.ACTIVE);
    RetryEntry entry = retryQueue.enqueue(new RetryTarget("c-1", "s-c-1", 1, "r-1", null),
        ErrorClass.TRANSIENT, TIMEOUT);

    assertTrue(retryQueue.markSucceeded(entry));
    assertFalse(retryQueue.markSucceeded(entry));
    RetryEntry afterRace = retryQueue.markFailed(entry, ErrorClass.TRANSIENT, TIMEOUT);
    assertEquals(RetryStatus.SUCCEEDED, afterRace.status());
    assertEquals(0, (int) connectionProvider.withConnection(conn -> retryQueue.countPending(conn, "c-1")));
  }

  @Test
  void exhaustedEntriesAreKeptForReview() {
    insertCampaign("c-1", CampaignStatus.ACTIVE);
    RetryTarget target = new RetryTarget("c-1", "s-c-1", 1, "r-1", null);
    RetryEntry entry = retryQueue.enqueue(target, ErrorClass.TRANSIENT, TIMEOUT);
    entry = retryQueue.markFailed(entry, ErrorClass.TRANSIENT, TIMEOUT);
    entry = retryQueue.markFailed(entry, ErrorClass.TRANSIENT, TIMEOUT);

    assertEquals(RetryStatus.FAILED, entry.status());
    List<RetryEntry> exhausted = retryQueue.exhaustedEntries("c-1", 10);
    assertEquals(1, exhausted.size());
    assertEquals(3, exhausted.get(0).attempt());
    assertEquals(3, exhausted.get(0).errorHistory().size());
  }

  @Test
  void scheduleClaimAndPauseHandshake() {
    insertCampaign("c-1", CampaignStatus.ACTIVE);
    insertSchedule("c-1", T0);
    Instant expiry = T0.minus(LOCK_TIMEOUT);

    connectionProvider.withConnection(conn -> {
      assertEquals(1, stores.campaigns().claim(conn, "s-c-1", "node-a", T0, expiry));
      assertEquals(0, stores.campaigns().claim(conn, "s-c-1", "node-b", T0, expiry));
      assertEquals(1, stores.campaigns().pause(conn, "s-c-1", T0));

      Schedule running = stores.campaigns().findSchedule(conn, "s-c-1").orElseThrow();
      assertEquals(ScheduleStatus.EXECUTING, running.status());
      assertEquals(1, running.executionCount());
      assertTrue(running.pauseRequested());

      assertEquals(1, stores.campaigns().reschedule(conn, "s-c-1", "node-a", T0.plus(Duration.ofDays(1)), T0));
      Schedule paused = stores.campaigns().findSchedule(conn, "s-c-1").orElseThrow();
      assertEquals(ScheduleStatus.PAUSED, paused.status());
      assertFalse(paused.pauseRequested());
      return null;
    });
  }

  @Test
  void deliveriesAreIdempotentPerOccurrence() {
    connectionProvider.withConnection(conn -> {
      assertTrue(stores.deliveries().insertIfAbsent(conn, delivery("r-1")));
      assertFalse(stores.deliveries().insertIfAbsent(conn, delivery("r-1")));
      assertEquals(1L, stores.deliveries().countByStatus(conn, "c-1").get(DeliveryStatus.SENT));
      return null;
    });
  }

  @Test
  void recipientsPageInIdOrder() {
    TestDatabase.insertRecipients(dataSource(), "r-3", "r-1", "r-2");

    List<String> first = connectionProvider.withConnection(
        conn -> stores.recipients().findIds(conn, SegmentFilter.matchAll(), null, 2));
    List<String> rest = connectionProvider.withConnection(
        conn -> stores.recipients().findIds(conn, SegmentFilter.matchAll(), "r-2", 2));

    assertEquals(List.of("r-1", "r-2"), first);
    assertEquals(List.of("r-3"), rest);
  }

  private void insertCampaign(String campaignId, CampaignStatus status) {
    connectionProvider.withConnection(conn -> {
      stores.campaigns().insertCampaign(conn, new Campaign(campaignId, "Title", "Hello", null,
          RecurrenceRule.of(RecurrencePattern.DAILY), status, T0, T0));
      return null;
    });
  }

  private void insertSchedule(String campaignId, Instant scheduledFor) {
    connectionProvider.withConnection(conn -> {
      stores.campaigns().insertSchedule(conn, new Schedule("s-" + campaignId, campaignId, scheduledFor,
          ScheduleStatus.SCHEDULED, 0, 0, false, null, null, null, null, T0));
      return null;
    });
  }

  private static Delivery delivery(String recipientId) {
    return new Delivery(UUID.randomUUID().toString(), "c-1", "s-c-1", 1, recipientId, null,
        DeliveryStatus.SENT, null, null, null, null, T0);
  }

  static void truncateAll(DataSource dataSource) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      for (String table : TABLES) {
        conn.createStatement().execute("TRUNCATE TABLE " + table);
      }
    }
  }
}
