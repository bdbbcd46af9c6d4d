package io.campaign.jdbc.store;

import io.campaign.jdbc.TestDatabase;
import io.campaign.model.AbTest;
import io.campaign.model.AbTestOutcome;
import io.campaign.model.AbTestStatus;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAbTestStoreTest {
  private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");

  @Test
  void latestTestWinsAndCompletesOnce() throws Exception {
    DataSource dataSource = TestDatabase.h2();
    JdbcAbTestStore store = new JdbcAbTestStore();
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, test("t-old", T0));
      store.insert(conn, test("t-new", T0.plusSeconds(60)));

      AbTest latest = store.findLatestByCampaign(conn, "c-1").orElseThrow();
      assertEquals("t-new", latest.testId());
      assertEquals(List.of("delivery_rate", "engagement_rate"), latest.metrics());
      assertEquals(0.3, latest.splitRatio(), 1e-9);
      assertTrue(latest.isActive());

      assertEquals(1, store.complete(conn, "t-new", AbTestOutcome.VARIANT_B, T0.plusSeconds(120)));
      assertEquals(0, store.complete(conn, "t-new", AbTestOutcome.VARIANT_A, T0.plusSeconds(180)));

      AbTest completed = store.find(conn, "t-new").orElseThrow();
      assertEquals(AbTestStatus.COMPLETED, completed.status());
      assertEquals(AbTestOutcome.VARIANT_B, completed.winner());
      assertEquals(T0.plusSeconds(120), completed.completedAt());
      assertTrue(store.findLatestByCampaign(conn, "c-2").isEmpty());
    }
  }

  private static AbTest test(String testId, Instant createdAt) {
    return new AbTest(testId, "c-1", "Variant A text", "Variant B text", 0.3,
        List.of("delivery_rate", "engagement_rate"), AbTestStatus.ACTIVE, null, createdAt, null);
  }
}
