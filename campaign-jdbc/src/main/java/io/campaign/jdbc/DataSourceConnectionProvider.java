package io.campaign.jdbc;

import io.campaign.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Hands the engine connections from a {@link DataSource}, normally a pool.
 *
 * <p>The dispatcher, the retry drainer and the operator facade borrow one connection per unit of
 * work (a schedule claim, one recipient's outcome, one retry attempt) and close it straight away,
 * so a pool of a few connections per engine node is enough. Auto-commit and transaction
 * boundaries are set by {@link ConnectionProvider#withConnection} and
 * {@link ConnectionProvider#inTransaction}, not here.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider {
  private final DataSource dataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }
}
