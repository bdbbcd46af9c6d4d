package io.campaign.retry;

import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.StoreException;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands a {@code null} connection to in-memory stores that never touch it.
 */
final class StubConnectionProvider implements ConnectionProvider {

  @Override
  public Connection getConnection() {
    throw new UnsupportedOperationException("in-memory stores need no connection");
  }

  @Override
  public <T> T withConnection(SqlFunction<T> action) {
    try {
      return action.apply(null);
    } catch (SQLException e) {
      throw new StoreException("Stub operation failed", e);
    }
  }

  @Override
  public <T> T inTransaction(SqlFunction<T> action) {
    return withConnection(action);
  }
}
