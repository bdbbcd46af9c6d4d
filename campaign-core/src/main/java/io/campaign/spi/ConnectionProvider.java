package io.campaign.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for engine operations (schedule claims, delivery writes,
 * retry queue updates, analytics queries).
 *
 * <p>Callers are responsible for closing the returned connection. {@link #withConnection} and
 * {@link #inTransaction} do that for them and wrap {@link SQLException} in {@link StoreException}.
 *
 * @see io.campaign.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {
  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;

  /**
   * Runs {@code action} on a fresh auto-commit connection and closes it afterwards.
   *
   * @throws StoreException if a connection cannot be obtained or the action fails with {@link SQLException}
   */
  default <T> T withConnection(SqlFunction<T> action) {
    try (Connection conn = getConnection()) {
      conn.setAutoCommit(true);
      return action.apply(conn);
    } catch (SQLException e) {
      throw new StoreException("Database operation failed", e);
    }
  }

  /**
   * Runs {@code action} in a single transaction: commits when it returns, rolls back when it throws.
   *
   * @throws StoreException if the transaction cannot be started, committed or the action fails with {@link SQLException}
   */
  default <T> T inTransaction(SqlFunction<T> action) {
    try (Connection conn = getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = action.apply(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException e) {
      throw new StoreException("Database transaction failed", e);
    }
  }

  /**
   * Work performed with a borrowed connection.
   */
  @FunctionalInterface
  interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }
}
