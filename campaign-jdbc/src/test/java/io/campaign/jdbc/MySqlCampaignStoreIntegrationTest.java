package io.campaign.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlCampaignStoreIntegrationTest extends AbstractCampaignStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("campaign_test");

  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    TestDatabase.runScript(dataSource, "/schema/mysql.sql");
  }

  @BeforeEach
  void truncate() throws Exception {
    truncateAll(dataSource);
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }
}
