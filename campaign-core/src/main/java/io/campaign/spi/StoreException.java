package io.campaign.spi;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * Unchecked wrapper for database failures raised by stores and connection handling.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns whether this failure (or any cause) is a unique or foreign key violation,
   * i.e. SQLSTATE class {@code 23}.
   */
  public boolean isConstraintViolation() {
    for (Throwable t = getCause(); t != null; t = t.getCause()) {
      if (t instanceof SQLIntegrityConstraintViolationException) {
        return true;
      }
      if (t instanceof SQLException sql && sql.getSQLState() != null
          && sql.getSQLState().startsWith("23")) {
        return true;
      }
    }
    return false;
  }
}
