package io.campaign.segment;

import io.campaign.model.Segment;
import io.campaign.model.SegmentFilter;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.RecipientStore;
import io.campaign.spi.SegmentStore;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a {@link SegmentFilter} into recipient ids against the {@link RecipientStore}.
 *
 * <p>Results are always bounded: {@link #page} reads one keyset page, {@link #resolve} stops
 * at the caller's cap. Opt-out and frequency limits are not applied here; see
 * {@link io.campaign.frequency.FrequencyGuard}.
 */
public final class SegmentResolver {
  private final ConnectionProvider connectionProvider;
  private final SegmentStore segmentStore;
  private final RecipientStore recipientStore;
  private final int pageSize;

  public SegmentResolver(ConnectionProvider connectionProvider, SegmentStore segmentStore,
      RecipientStore recipientStore, int pageSize) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.segmentStore = Objects.requireNonNull(segmentStore, "segmentStore");
    this.recipientStore = Objects.requireNonNull(recipientStore, "recipientStore");
    if (pageSize <= 0) {
      throw new IllegalArgumentException("pageSize must be > 0");
    }
    this.pageSize = pageSize;
  }

  public int pageSize() {
    return pageSize;
  }

  public Optional<Segment> segment(String segmentId) {
    return connectionProvider.withConnection(conn -> segmentStore.find(conn, segmentId));
  }

  /**
   * Reads the page of matching ids that follows {@code afterId}.
   *
   * @param afterId last id of the previous page, or {@code null} for the first page
   * @return up to {@link #pageSize()} ids in ascending order
   */
  public List<String> page(SegmentFilter filter, String afterId) {
    Objects.requireNonNull(filter, "filter");
    return connectionProvider.withConnection(conn -> recipientStore.findIds(conn, filter, afterId, pageSize));
  }

  /**
   * Resolves at most {@code limit} matching ids, reading page by page.
   */
  public List<String> resolve(SegmentFilter filter, int limit) {
    Objects.requireNonNull(filter, "filter");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return connectionProvider.withConnection(conn -> collect(conn, filter, limit));
  }

  /**
   * Resolves a stored segment.
   *
   * @throws IllegalArgumentException if the segment does not exist
   */
  public List<String> resolveSegment(String segmentId, int limit) {
    Segment segment = segment(segmentId)
        .orElseThrow(() -> new IllegalArgumentException("Unknown segment: " + segmentId));
    return resolve(segment.filter(), limit);
  }

  private List<String> collect(Connection conn, SegmentFilter filter, int limit) {
    List<String> ids = new ArrayList<>();
    String cursor = null;
    while (ids.size() < limit) {
      int batch = Math.min(pageSize, limit - ids.size());
      List<String> page = recipientStore.findIds(conn, filter, cursor, batch);
      ids.addAll(page);
      if (page.size() < batch) {
        break;
      }
      cursor = page.get(page.size() - 1);
    }
    return ids;
  }
}
