package io.campaign.jdbc;

import io.campaign.jdbc.retry.AbstractJdbcRetryQueueStore;
import io.campaign.jdbc.retry.JdbcRetryQueueStores;
import io.campaign.jdbc.store.JdbcAbTestStore;
import io.campaign.jdbc.store.JdbcCampaignStore;
import io.campaign.jdbc.store.JdbcDeliveryStore;
import io.campaign.jdbc.store.JdbcEngagementStore;
import io.campaign.jdbc.store.JdbcRecipientStore;
import io.campaign.jdbc.store.JdbcSegmentStore;
import io.campaign.spi.CampaignStores;
import io.campaign.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Builds the full set of JDBC stores for one database.
 *
 * <pre>{@code
 * CampaignStores stores = JdbcCampaignStores.create(dataSource);
 * }</pre>
 */
public final class JdbcCampaignStores {

  private JdbcCampaignStores() {
  }

  /**
   * Stores with default table names; the retry queue dialect is detected from the DataSource.
   */
  public static CampaignStores create(DataSource dataSource) {
    return create(dataSource, TableNames.DEFAULTS);
  }

  public static CampaignStores create(DataSource dataSource, TableNames tables) {
    Objects.requireNonNull(dataSource, "dataSource");
    try (Connection conn = dataSource.getConnection()) {
      return create(conn.getMetaData().getURL(), tables, JsonCodec.getDefault());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect database from DataSource", e);
    }
  }

  /**
   * Stores for the database behind {@code jdbcUrl}.
   *
   * @throws IllegalArgumentException if no retry queue store handles the URL
   */
  public static CampaignStores create(String jdbcUrl, TableNames tables, JsonCodec jsonCodec) {
    AbstractJdbcRetryQueueStore retries = JdbcRetryQueueStores.detect(jdbcUrl, tables, jsonCodec);
    return create(retries, tables, jsonCodec);
  }

  /**
   * Stores sharing {@code tables}, using the given retry queue dialect.
   */
  public static CampaignStores create(AbstractJdbcRetryQueueStore retries, TableNames tables, JsonCodec jsonCodec) {
    Objects.requireNonNull(retries, "retries");
    Objects.requireNonNull(tables, "tables");
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    return new CampaignStores(
        new JdbcCampaignStore(tables),
        new JdbcDeliveryStore(tables),
        retries.with(tables, jsonCodec),
        new JdbcSegmentStore(tables),
        new JdbcRecipientStore(tables),
        new JdbcEngagementStore(tables, jsonCodec),
        new JdbcAbTestStore(tables));
  }
}
