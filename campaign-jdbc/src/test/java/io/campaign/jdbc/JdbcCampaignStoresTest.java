package io.campaign.jdbc;

import io.campaign.CampaignDefinition;
import io.campaign.CampaignEngine;
import io.campaign.model.Campaign;
import io.campaign.model.CampaignStatus;
import io.campaign.jdbc.retry.H2RetryQueueStore;
import io.campaign.jdbc.retry.JdbcRetryQueueStores;
import io.campaign.jdbc.retry.MySqlRetryQueueStore;
import io.campaign.jdbc.retry.PostgresRetryQueueStore;
import io.campaign.spi.CampaignStores;
import io.campaign.util.JsonCodec;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCampaignStoresTest {
  private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");

  @Test
  void detectsRetryQueueDialectFromUrl() {
    assertInstanceOf(H2RetryQueueStore.class, JdbcRetryQueueStores.detect("jdbc:h2:mem:test"));
    assertInstanceOf(PostgresRetryQueueStore.class, JdbcRetryQueueStores.detect("jdbc:postgresql://db/app"));
    assertInstanceOf(MySqlRetryQueueStore.class, JdbcRetryQueueStores.detect("jdbc:mysql://db/app"));
    assertInstanceOf(MySqlRetryQueueStore.class, JdbcRetryQueueStores.detect("JDBC:TIDB://db/app"));
    assertInstanceOf(PostgresRetryQueueStore.class, JdbcRetryQueueStores.get("POSTGRESQL"));
    assertEquals(3, JdbcRetryQueueStores.all().size());
  }

  @Test
  void unknownDatabaseIsRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> JdbcCampaignStores.create("jdbc:sqlite:file.db", TableNames.DEFAULTS, JsonCodec.getDefault()));
    assertTrue(e.getMessage().contains("jdbc:h2:"));
    assertThrows(IllegalArgumentException.class, () -> JdbcRetryQueueStores.detect(""));
    assertThrows(IllegalArgumentException.class, () -> JdbcRetryQueueStores.get("oracle"));
  }

  @Test
  void createDetectsDialectFromDataSource() {
    CampaignStores stores = JdbcCampaignStores.create(TestDatabase.h2());

    assertInstanceOf(H2RetryQueueStore.class, stores.retries());
  }

  @Test
  void prefixedTablesAreUsedEndToEnd() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:prefixed_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    createPrefixedSchema(ds, "mkt_");
    TestDatabase.execute(ds, "INSERT INTO mkt_recipients (recipient_id) VALUES (?)", "r-1");

    ScriptedSendCollaborator transport = new ScriptedSendCollaborator();
    try (CampaignEngine engine = CampaignEngine.builder()
        .connectionProvider(new DataSourceConnectionProvider(ds))
        .stores(JdbcCampaignStores.create(ds, TableNames.withPrefix("mkt_")))
        .sendCollaborator(transport)
        .clock(new MutableClock(T0))
        .build()) {
      Campaign campaign = engine.operations().createCampaign(CampaignDefinition.builder()
          .title("Prefixed").content("Hi").startAt(T0).build());
      engine.dispatcher().tick();

      assertEquals(1, transport.calls().size());
      assertEquals(CampaignStatus.COMPLETED,
          engine.operations().campaign(campaign.campaignId()).orElseThrow().status());
      assertEquals(1, TestDatabase.queryLong(ds, "SELECT COUNT(*) FROM mkt_deliveries"));
    }
  }

  private static void createPrefixedSchema(JdbcDataSource ds, String prefix) throws Exception {
    String script;
    try (var in = JdbcCampaignStoresTest.class.getResourceAsStream("/schema/h2.sql")) {
      script = new String(in.readAllBytes(), java.nio.charset.StandardCharsets.UTF_8);
    }
    String prefixed = script.replaceAll(
        "\\b(campaigns|schedules|deliveries|retry_queue|segments|recipients|engagement_events|ab_tests)\\b",
        prefix + "$1");
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : prefixed.split(";")) {
        if (!sql.isBlank()) {
          stmt.execute(sql.trim());
        }
      }
    }
  }
}
