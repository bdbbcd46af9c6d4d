package io.campaign.spi;

import io.campaign.model.Segment;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for named segment definitions.
 */
public interface SegmentStore {

  void insert(Connection conn, Segment segment);

  Optional<Segment> find(Connection conn, String segmentId);

  List<Segment> findAll(Connection conn);
}
