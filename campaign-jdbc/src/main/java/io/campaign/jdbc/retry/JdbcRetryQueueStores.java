package io.campaign.jdbc.retry;

import io.campaign.jdbc.TableNames;
import io.campaign.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC retry queue stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.campaign.jdbc.retry.AbstractJdbcRetryQueueStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcRetryQueueStore store = JdbcRetryQueueStores.detect(dataSource);
 *
 * // Get by name
 * AbstractJdbcRetryQueueStore store = JdbcRetryQueueStores.get("postgresql");
 * }</pre>
 */
public final class JdbcRetryQueueStores {

  private static final List<AbstractJdbcRetryQueueStore> STORES;
  private static final Map<String, AbstractJdbcRetryQueueStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcRetryQueueStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcRetryQueueStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcRetryQueueStores() {
  }

  /**
   * Returns all registered stores.
   */
  public static List<AbstractJdbcRetryQueueStore> all() {
    return STORES;
  }

  /**
   * Gets a store by name.
   *
   * @param name store name (case-insensitive)
   * @throws IllegalArgumentException if no store is registered under that name
   */
  public static AbstractJdbcRetryQueueStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcRetryQueueStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown retry queue store: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the store from a DataSource.
   *
   * @throws IllegalStateException if detection fails or no matching store
   */
  public static AbstractJdbcRetryQueueStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect retry queue store from DataSource", e);
    }
  }

  /**
   * Auto-detects the store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching store found
   */
  public static AbstractJdbcRetryQueueStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    for (AbstractJdbcRetryQueueStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No retry queue store found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  /**
   * Auto-detects the store from a JDBC URL and configures it with the given tables and codec.
   */
  public static AbstractJdbcRetryQueueStore detect(String jdbcUrl, TableNames tables, JsonCodec jsonCodec) {
    Objects.requireNonNull(tables, "tables");
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    return detect(jdbcUrl).with(tables, jsonCodec);
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
