package io.campaign.jdbc.store;

import io.campaign.jdbc.TestDatabase;
import io.campaign.model.RecipientPreferences;
import io.campaign.model.SegmentFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcRecipientStoreTest {
  private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");

  private DataSource dataSource;
  private JdbcRecipientStore store;

  @BeforeEach
  void setUp() {
    dataSource = TestDatabase.h2();
    store = new JdbcRecipientStore();
    TestDatabase.insertRecipient(dataSource, "r-1", 10, "basic", "US", "en", Instant.parse("2023-06-01T00:00:00Z"));
    TestDatabase.insertRecipient(dataSource, "r-2", 80, "gold", "DE", "de", Instant.parse("2024-02-01T00:00:00Z"));
    TestDatabase.insertRecipient(dataSource, "r-3", 95, "gold", "US", "en", Instant.parse("2024-03-01T00:00:00Z"));
    TestDatabase.insertRecipient(dataSource, "r-4", 60, "silver", "FR", "fr", Instant.parse("2024-04-01T00:00:00Z"));
  }

  @Test
  void matchAllReturnsEveryRecipientInIdOrder() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(List.of("r-1", "r-2", "r-3", "r-4"), store.findIds(conn, SegmentFilter.matchAll(), null, 10));
    }
  }

  @Test
  void dimensionsCombineWithAnd() throws Exception {
    SegmentFilter filter = SegmentFilter.builder()
        .minActivityScore(50)
        .tiers("gold", "silver")
        .countries("US", "FR")
        .build();
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(List.of("r-3", "r-4"), store.findIds(conn, filter, null, 10));
    }
  }

  @Test
  void registrationWindowIsInclusive() throws Exception {
    SegmentFilter filter = SegmentFilter.builder()
        .registeredAfter(Instant.parse("2024-02-01T00:00:00Z"))
        .registeredBefore(Instant.parse("2024-03-01T00:00:00Z"))
        .build();
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(List.of("r-2", "r-3"), store.findIds(conn, filter, null, 10));
    }
  }

  @Test
  void languagesFilter() throws Exception {
    SegmentFilter filter = SegmentFilter.builder().languages("de", "fr").build();
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(List.of("r-2", "r-4"), store.findIds(conn, filter, null, 10));
    }
  }

  @Test
  void pagesWithKeysetCursor() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      List<String> first = store.findIds(conn, SegmentFilter.matchAll(), null, 3);
      List<String> second = store.findIds(conn, SegmentFilter.matchAll(), first.get(first.size() - 1), 3);

      assertEquals(List.of("r-1", "r-2", "r-3"), first);
      assertEquals(List.of("r-4"), second);
    }
  }

  @Test
  void preferencesTrackWeeklySendsAndOptOut() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(1, store.incrementWeeklySends(conn, "r-1", T0));
      assertEquals(1, store.incrementWeeklySends(conn, "r-1", T0));
      assertEquals(1, store.updateOptOut(conn, "r-1", true, "user request", T0));
      assertEquals(0, store.incrementWeeklySends(conn, "unknown", T0));

      RecipientPreferences prefs = store.findPreferences(conn, "r-1").orElseThrow();
      assertEquals(2, prefs.sendsThisWeek());
      assertTrue(prefs.optedOut());
      assertNull(prefs.maxSendsPerWeek());

      store.updateOptOut(conn, "r-1", false, null, T0);
      assertFalse(store.findPreferences(conn, "r-1").orElseThrow().optedOut());
      assertTrue(store.findPreferences(conn, "unknown").isEmpty());
    }
  }
}
