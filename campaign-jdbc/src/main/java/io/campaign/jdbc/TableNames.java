package io.campaign.jdbc;

import java.util.Objects;

/**
 * Physical table names used by the JDBC stores. All names share an optional prefix.
 */
public final class TableNames {
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  public static final TableNames DEFAULTS = new TableNames("");

  private final String prefix;

  private TableNames(String prefix) {
    this.prefix = prefix;
  }

  /**
   * Table names starting with {@code prefix}, e.g. {@code "mkt_"} gives {@code mkt_campaigns}.
   */
  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.isEmpty()) {
      validate(prefix);
    }
    return new TableNames(prefix);
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  public String prefix() {
    return prefix;
  }

  public String campaigns() {
    return prefix + "campaigns";
  }

  public String schedules() {
    return prefix + "schedules";
  }

  public String deliveries() {
    return prefix + "deliveries";
  }

  public String retryQueue() {
    return prefix + "retry_queue";
  }

  public String segments() {
    return prefix + "segments";
  }

  public String recipients() {
    return prefix + "recipients";
  }

  public String engagementEvents() {
    return prefix + "engagement_events";
  }

  public String abTests() {
    return prefix + "ab_tests";
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TableNames other && prefix.equals(other.prefix);
  }

  @Override
  public int hashCode() {
    return prefix.hashCode();
  }

  @Override
  public String toString() {
    return "TableNames{prefix='" + prefix + "'}";
  }
}
