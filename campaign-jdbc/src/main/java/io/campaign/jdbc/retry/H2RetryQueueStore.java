package io.campaign.jdbc.retry;

import io.campaign.jdbc.TableNames;
import io.campaign.util.JsonCodec;

import java.util.List;

/**
 * H2 retry queue store. Primarily for testing.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcRetryQueueStore}.
 */
public final class H2RetryQueueStore extends AbstractJdbcRetryQueueStore {

  public H2RetryQueueStore() {
    super();
  }

  public H2RetryQueueStore(TableNames tables, JsonCodec jsonCodec) {
    super(tables, jsonCodec);
  }

  @Override
  public AbstractJdbcRetryQueueStore with(TableNames tables, JsonCodec jsonCodec) {
    return new H2RetryQueueStore(tables, jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
