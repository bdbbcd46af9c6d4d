package io.campaign.jdbc;

import io.campaign.spi.StoreException;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void nullDataSourceThrows() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }

  @Test
  void delegatesToDataSource() throws SQLException {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(TestDatabase.h2());

    try (Connection conn = provider.getConnection()) {
      assertFalse(conn.isClosed());
    }
  }

  @Test
  void transactionRollsBackWhenTheActionFails() {
    DataSource dataSource = TestDatabase.h2();
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(dataSource);

    assertThrows(IllegalStateException.class, () -> provider.inTransaction(conn -> {
      JdbcTemplate.update(conn, "INSERT INTO recipients (recipient_id) VALUES (?)", "r-1");
      throw new IllegalStateException("boom");
    }));
    assertEquals(0, TestDatabase.queryLong(dataSource, "SELECT COUNT(*) FROM recipients"));

    provider.inTransaction(conn -> JdbcTemplate.update(conn, "INSERT INTO recipients (recipient_id) VALUES (?)", "r-1"));
    assertEquals(1, TestDatabase.queryLong(dataSource, "SELECT COUNT(*) FROM recipients"));
  }

  @Test
  void sqlFailuresSurfaceAsStoreException() {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(TestDatabase.h2());

    StoreException e = assertThrows(StoreException.class,
        () -> provider.withConnection(conn -> JdbcTemplate.update(conn, "INSERT INTO no_such_table VALUES (1)")));
    assertFalse(e.isConstraintViolation());
  }

  @Test
  void duplicateKeyIsReportedAsConstraintViolation() {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(TestDatabase.h2());
    provider.withConnection(conn -> JdbcTemplate.update(conn, "INSERT INTO recipients (recipient_id) VALUES (?)", "r-1"));

    StoreException e = assertThrows(StoreException.class, () -> provider.withConnection(
        conn -> JdbcTemplate.update(conn, "INSERT INTO recipients (recipient_id) VALUES (?)", "r-1")));
    assertTrue(e.isConstraintViolation());
  }
}
