package io.campaign.jdbc;

import javax.sql.DataSource;

class H2CampaignStoreIntegrationTest extends AbstractCampaignStoreIntegrationTest {
  // Created per test instance so it exists before the superclass's @BeforeEach runs.
  private final DataSource dataSource = TestDatabase.h2();

  @Override
  DataSource dataSource() {
    return dataSource;
  }
}
