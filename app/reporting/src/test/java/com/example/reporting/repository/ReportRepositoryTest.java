/*
 * どこで: ReportRepository の統合テスト
 * 何を: ACTIVE 一意性のインデックスと締め更新のガードを検証する
 * なぜ: アプリ側の直列化が破れてもストアが不変条件を守ることを確認するため
 */
package com.example.reporting.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.reporting.AbstractPostgresContainerTest;
import com.example.reporting.model.ReportRecord;
import com.example.reporting.model.ReportStatus;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ReportRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private ReportRepository reportRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM activity_events", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM reports", new MapSqlParameterSource());
  }

  @Test
  void partialUniqueIndexRejectsSecondActiveReport() {
    reportRepository.insertActive(BASE_TIME, BASE_TIME);

    assertThatThrownBy(() -> reportRepository.insertActive(BASE_TIME, BASE_TIME))
        .isInstanceOf(DuplicateKeyException.class);
    assertThat(reportRepository.countActive()).isEqualTo(1);
  }

  @Test
  void markFrozenOnlyAppliesOnce() {
    final long reportId = reportRepository.insertActive(BASE_TIME, BASE_TIME);
    final Instant periodEnd = BASE_TIME.plusSeconds(3600);

    final int first =
        reportRepository.markFrozen(reportId, periodEnd, periodEnd, 3, "{\"total_events\":3}");
    final int second = reportRepository.markFrozen(reportId, periodEnd, periodEnd, 9, "{}");

    assertThat(first).isEqualTo(1);
    assertThat(second).isZero();
    final ReportRecord frozen = reportRepository.findById(reportId).orElseThrow();
    assertThat(frozen.status()).isEqualTo(ReportStatus.FROZEN);
    assertThat(frozen.periodEnd()).isEqualTo(periodEnd);
    assertThat(frozen.eventCount()).isEqualTo(3);
    assertThat(frozen.summaryJson()).contains("\"total_events\"");
    assertThat(reportRepository.findActive()).isEmpty();
  }

  @Test
  void frozenLookupsFollowFreezeOrder() {
    final long first = freeze(BASE_TIME, BASE_TIME.plusSeconds(60));
    final long second = freeze(BASE_TIME.plusSeconds(60), BASE_TIME.plusSeconds(120));
    reportRepository.insertActive(BASE_TIME.plusSeconds(120), BASE_TIME.plusSeconds(120));

    assertThat(reportRepository.findLastFrozen()).get().extracting(ReportRecord::id).isEqualTo(second);
    assertThat(reportRepository.findLastFrozenBefore(second))
        .get()
        .extracting(ReportRecord::id)
        .isEqualTo(first);
    assertThat(reportRepository.findLastFrozenBefore(first)).isEmpty();
    assertThat(reportRepository.findAllFrozen(10, 0))
        .extracting(ReportRecord::id)
        .containsExactly(second, first);
    assertThat(reportRepository.findAllFrozen(10, 1))
        .extracting(ReportRecord::id)
        .containsExactly(first);
  }

  @Test
  void markEmailedIgnoresActiveReport() {
    final long frozen = freeze(BASE_TIME, BASE_TIME.plusSeconds(60));
    final long active = reportRepository.insertActive(BASE_TIME, BASE_TIME);

    assertThat(reportRepository.markEmailed(active, BASE_TIME)).isZero();
    assertThat(reportRepository.markEmailed(frozen, BASE_TIME.plusSeconds(90))).isEqualTo(1);
    final ReportRecord emailed = reportRepository.findById(frozen).orElseThrow();
    assertThat(emailed.emailed()).isTrue();
    assertThat(emailed.emailedAt()).isEqualTo(BASE_TIME.plusSeconds(90));
  }

  private long freeze(Instant periodStart, Instant periodEnd) {
    final long reportId = reportRepository.insertActive(periodStart, periodStart);
    reportRepository.markFrozen(reportId, periodEnd, periodEnd, 0, "{}");
    return reportId;
  }
}
