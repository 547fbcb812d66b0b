/*
 * どこで: Reporting データアクセス
 * 何を: activity_events テーブルの追記/クレーム/参照を担う
 * なぜ: イベントを未割当のまま溜め、締め時にだけレポートへ紐付けるため
 */
package com.example.reporting.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.reporting.model.EventDraft;
import com.example.reporting.model.EventRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EventRepository {

  public static final String RECENT_UNASSIGNED_CACHE = "recent-unassigned-events";

  private static final String SELECT_COLUMNS =
      """
      SELECT id, event_type, event_subtype, object_id, user_id,
             event_data::text AS event_data_text, source, event_timestamp, report_id
      FROM activity_events
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @CacheEvict(cacheNames = RECENT_UNASSIGNED_CACHE, allEntries = true)
  public long insert(EventDraft draft) {
    // report_id は必ず NULL で登録し、帰属は claimForPeriod だけが決める
    final String sql =
        """
        INSERT INTO activity_events (
          event_type,
          event_subtype,
          object_id,
          user_id,
          event_data,
          source,
          event_timestamp,
          report_id
        ) VALUES (
          :eventType,
          :eventSubtype,
          :objectId,
          :userId,
          :eventData::jsonb,
          :source,
          :eventTimestamp,
          NULL
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventType", draft.eventType())
            .addValue("eventSubtype", draft.eventSubtype())
            .addValue("objectId", draft.objectId())
            .addValue("userId", draft.userId())
            .addValue("eventData", draft.eventDataJson())
            .addValue("source", draft.source())
            .addValue("eventTimestamp", toTimestamp(draft.eventTimestamp()));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("insert did not return an id");
    }
    return id;
  }

  @CacheEvict(cacheNames = RECENT_UNASSIGNED_CACHE, allEntries = true)
  public int claimForPeriod(long reportId, Instant periodStart, Instant periodEnd) {
    // 未割当のみを対象にするため、再実行しても他レポートの行は奪わない(両端を含む)
    final String sql =
        """
        UPDATE activity_events
        SET report_id = :reportId
        WHERE report_id IS NULL
          AND event_timestamp >= :periodStart
          AND event_timestamp <= :periodEnd
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reportId", reportId)
            .addValue("periodStart", toTimestamp(periodStart))
            .addValue("periodEnd", toTimestamp(periodEnd));
    return jdbcTemplate.update(sql, params);
  }

  public List<EventRecord> findByReport(Long reportId, int limit, int offset) {
    final String sql =
        SELECT_COLUMNS
            + (reportId == null ? "WHERE report_id IS NULL\n" : "WHERE report_id = :reportId\n")
            + """
            ORDER BY event_timestamp DESC, id DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reportId", reportId)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<EventRecord> findAllByReport(long reportId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE report_id = :reportId
            ORDER BY event_timestamp DESC, id DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("reportId", reportId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Cacheable(cacheNames = RECENT_UNASSIGNED_CACHE, key = "#limit")
  public List<EventRecord> findRecentUnassigned(int limit) {
    return List.copyOf(findByReport(null, limit, 0));
  }

  public List<EventRecord> findByType(String eventType, Long reportId, int limit) {
    // 種別は部分一致(例: "comment" で comment_posted/comment_approved を拾う)
    final String sql =
        SELECT_COLUMNS
            + "WHERE event_type LIKE :pattern ESCAPE '\\'\n"
            + (reportId == null ? "  AND report_id IS NULL\n" : "  AND report_id = :reportId\n")
            + """
            ORDER BY event_timestamp DESC, id DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("pattern", "%" + escapeLike(eventType) + "%")
            .addValue("reportId", reportId)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public Map<String, Long> countByType(Long reportId) {
    final String sql =
        """
        SELECT event_type, COUNT(*) AS event_count
        FROM activity_events
        """
            + (reportId == null ? "WHERE report_id IS NULL\n" : "WHERE report_id = :reportId\n")
            + """
            GROUP BY event_type
            ORDER BY event_count DESC, event_type
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("reportId", reportId);
    final Map<String, Long> counts = new LinkedHashMap<>();
    jdbcTemplate.query(
        sql, params, rs -> {
          counts.put(rs.getString("event_type"), rs.getLong("event_count"));
        });
    return counts;
  }

  public Optional<EventRecord> findLastEventFor(String eventType, long objectId) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE event_type = :eventType
              AND object_id = :objectId
            ORDER BY event_timestamp DESC, id DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("eventType", eventType).addValue("objectId", objectId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public long countAll() {
    return count("SELECT COUNT(*) FROM activity_events");
  }

  public long countUnassigned() {
    return count("SELECT COUNT(*) FROM activity_events WHERE report_id IS NULL");
  }

  private long count(String sql) {
    final Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
    return count == null ? 0L : count;
  }

  private String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private EventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new EventRecord(
        rs.getLong("id"),
        rs.getString("event_type"),
        rs.getString("event_subtype"),
        rs.getObject("object_id", Long.class),
        rs.getObject("user_id", Long.class),
        rs.getString("event_data_text"),
        rs.getString("source"),
        toInstant(rs.getTimestamp("event_timestamp")),
        rs.getObject("report_id", Long.class));
  }
}
