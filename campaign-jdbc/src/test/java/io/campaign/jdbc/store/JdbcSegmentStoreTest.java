package io.campaign.jdbc.store;

import io.campaign.jdbc.TestDatabase;
import io.campaign.model.Segment;
import io.campaign.model.SegmentFilter;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSegmentStoreTest {
  private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");

  @Test
  void storesFilterDimensions() throws Exception {
    DataSource dataSource = TestDatabase.h2();
    JdbcSegmentStore store = new JdbcSegmentStore();
    SegmentFilter filter = SegmentFilter.builder()
        .minActivityScore(70)
        .tiers("gold", "platinum")
        .countries("DE")
        .languages("de", "en")
        .registeredAfter(Instant.parse("2024-01-01T00:00:00Z"))
        .registeredBefore(Instant.parse("2024-06-01T00:00:00Z"))
        .build();
    try (Connection conn = dataSource.getConnection()) {
      store.insert(conn, new Segment("seg-1", "Engaged Germans", "high activity", filter, T0));
      store.insert(conn, new Segment("seg-2", "Everyone", null, SegmentFilter.matchAll(), T0));

      Segment found = store.find(conn, "seg-1").orElseThrow();
      assertEquals(filter, found.filter());
      assertEquals("high activity", found.description());

      assertTrue(store.find(conn, "seg-2").orElseThrow().filter().isEmpty());
      assertEquals(List.of("Engaged Germans", "Everyone"), store.findAll(conn).stream().map(Segment::name).toList());
      assertTrue(store.find(conn, "missing").isEmpty());
    }
  }
}
