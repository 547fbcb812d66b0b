/*
 * どこで: Reporting データアクセス
 * 何を: reports テーブルの登録/取得/締め更新を担う
 * なぜ: 「ACTIVE は常に1件」をストアから毎回導出し、プロセス内に状態を持たないため
 */
package com.example.reporting.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.reporting.model.ReportRecord;
import com.example.reporting.model.ReportStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ReportRepository {

  // レポート系列は1本のみなので advisory lock のキーも固定値でよい
  static final long REPORT_STREAM_LOCK_KEY = 0x5245504F5254L;

  private static final String SELECT_COLUMNS =
      """
      SELECT id, status, period_start, period_end, frozen_at, event_count,
             summary_data::text AS summary_data_text, emailed, emailed_at, created_at
      FROM reports
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void lockReportStream() {
    // トランザクション終了で自動解放される。締めとロールオーバーを直列化する
    final String sql = "SELECT pg_advisory_xact_lock(:lockKey)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("lockKey", REPORT_STREAM_LOCK_KEY);
    jdbcTemplate.query(sql, params, rs -> null);
  }

  public long insertActive(Instant periodStart, Instant createdAt) {
    final String sql =
        """
        INSERT INTO reports (
          status,
          period_start,
          event_count,
          emailed,
          created_at
        ) VALUES (
          'ACTIVE',
          :periodStart,
          0,
          FALSE,
          :createdAt
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("periodStart", toTimestamp(periodStart))
            .addValue("createdAt", toTimestamp(createdAt));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("insert did not return an id");
    }
    return id;
  }

  public Optional<ReportRecord> findActive() {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = 'ACTIVE'
            ORDER BY created_at DESC, id DESC
            LIMIT 1
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow).stream().findFirst();
  }

  public Optional<ReportRecord> findById(long reportId) {
    final String sql = SELECT_COLUMNS + "WHERE id = :reportId\n";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("reportId", reportId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ReportRecord> findByIdForUpdate(long reportId) {
    final String sql = SELECT_COLUMNS + "WHERE id = :reportId\nFOR UPDATE\n";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("reportId", reportId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<ReportRecord> findLastFrozen() {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = 'FROZEN'
            ORDER BY frozen_at DESC, id DESC
            LIMIT 1
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow).stream().findFirst();
  }

  public Optional<ReportRecord> findLastFrozenBefore(long reportId) {
    // id は単調増加なので「直前の期間」は id の大小で決まる
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = 'FROZEN'
              AND id < :reportId
            ORDER BY id DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("reportId", reportId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ReportRecord> findAllFrozen(int limit, int offset) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = 'FROZEN'
            ORDER BY frozen_at DESC, id DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markFrozen(
      long reportId, Instant periodEnd, Instant frozenAt, int eventCount, String summaryJson) {
    // 状態・期間終端・件数・本文を1文で書き、部分的な締め状態を作らない
    final String sql =
        """
        UPDATE reports
        SET status = 'FROZEN',
            period_end = :periodEnd,
            frozen_at = :frozenAt,
            event_count = :eventCount,
            summary_data = :summaryData::jsonb
        WHERE id = :reportId
          AND status = 'ACTIVE'
          AND period_end IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("periodEnd", toTimestamp(periodEnd))
            .addValue("frozenAt", toTimestamp(frozenAt))
            .addValue("eventCount", eventCount)
            .addValue("summaryData", summaryJson)
            .addValue("reportId", reportId);
    return jdbcTemplate.update(sql, params);
  }

  public int markEmailed(long reportId, Instant emailedAt) {
    final String sql =
        """
        UPDATE reports
        SET emailed = TRUE,
            emailed_at = :emailedAt
        WHERE id = :reportId
          AND status = 'FROZEN'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("emailedAt", toTimestamp(emailedAt))
            .addValue("reportId", reportId);
    return jdbcTemplate.update(sql, params);
  }

  public int countActive() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM reports WHERE status = 'ACTIVE'",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  public long sumFrozenEventCount() {
    final Long sum =
        jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(event_count), 0) FROM reports WHERE status = 'FROZEN'",
            new MapSqlParameterSource(),
            Long.class);
    return sum == null ? 0L : sum;
  }

  private ReportRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ReportRecord(
        rs.getLong("id"),
        ReportStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("period_start")),
        toInstant(rs.getTimestamp("period_end")),
        toInstant(rs.getTimestamp("frozen_at")),
        rs.getInt("event_count"),
        rs.getString("summary_data_text"),
        rs.getBoolean("emailed"),
        toInstant(rs.getTimestamp("emailed_at")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
