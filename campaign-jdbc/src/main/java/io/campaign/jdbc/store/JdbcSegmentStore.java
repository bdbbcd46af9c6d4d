package io.campaign.jdbc.store;

import io.campaign.jdbc.JdbcTemplate;
import io.campaign.jdbc.TableNames;
import io.campaign.model.Segment;
import io.campaign.model.SegmentFilter;
import io.campaign.spi.SegmentStore;

import java.sql.Connection;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC segment store. Allow-lists are stored as comma-separated values; empty means no constraint.
 */
public final class JdbcSegmentStore implements SegmentStore {
  private static final String COLUMNS = "segment_id, name, description, min_activity_score, tiers, "
      + "countries, languages, registered_after, registered_before, created_at";

  private static final JdbcTemplate.RowMapper<Segment> ROW_MAPPER = rs -> new Segment(
      rs.getString("segment_id"),
      rs.getString("name"),
      rs.getString("description"),
      SegmentFilter.builder()
          .minActivityScore(JdbcTemplate.nullableInt(rs, "min_activity_score"))
          .tiers(split(rs.getString("tiers")))
          .countries(split(rs.getString("countries")))
          .languages(split(rs.getString("languages")))
          .registeredAfter(JdbcTemplate.instant(rs, "registered_after"))
          .registeredBefore(JdbcTemplate.instant(rs, "registered_before"))
          .build(),
      JdbcTemplate.instant(rs, "created_at"));

  private final TableNames tables;

  public JdbcSegmentStore() {
    this(TableNames.DEFAULTS);
  }

  public JdbcSegmentStore(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  @Override
  public void insert(Connection conn, Segment segment) {
    SegmentFilter filter = segment.filter();
    String sql = "INSERT INTO " + tables.segments() + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        segment.segmentId(), segment.name(), segment.description(), filter.minActivityScore(),
        join(filter.tiers()), join(filter.countries()), join(filter.languages()),
        filter.registeredAfter(), filter.registeredBefore(), segment.createdAt());
  }

  @Override
  public Optional<Segment> find(Connection conn, String segmentId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables.segments() + " WHERE segment_id=?";
    return JdbcTemplate.queryOne(conn, sql, ROW_MAPPER, segmentId);
  }

  @Override
  public List<Segment> findAll(Connection conn) {
    String sql = "SELECT " + COLUMNS + " FROM " + tables.segments() + " ORDER BY name, segment_id";
    return JdbcTemplate.query(conn, sql, ROW_MAPPER);
  }

  private static String join(Set<String> values) {
    return values.isEmpty() ? null : String.join(",", values);
  }

  private static List<String> split(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
  }
}
