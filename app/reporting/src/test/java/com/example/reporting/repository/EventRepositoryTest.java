/*
 * どこで: EventRepository の統合テスト
 * 何を: 追記/クレーム/集計クエリの挙動を検証する
 * なぜ: 帰属の一意性とクレームの冪等性をストア側で保証するため
 */
package com.example.reporting.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.reporting.AbstractPostgresContainerTest;
import com.example.reporting.model.EventDraft;
import com.example.reporting.model.EventRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class EventRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private EventRepository eventRepository;

  @Autowired private ReportRepository reportRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Autowired private CacheManager cacheManager;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM activity_events", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM reports", new MapSqlParameterSource());
    cacheManager.getCacheNames().forEach(name -> cacheManager.getCache(name).clear());
  }

  @Test
  void insertStoresUnassignedEventWithJsonData() {
    final long id =
        eventRepository.insert(
            new EventDraft(
                "post_published",
                "post",
                42L,
                7L,
                "{\"object\":{\"title\":\"Hello\"}}",
                "core",
                BASE_TIME));

    final List<EventRecord> unassigned = eventRepository.findByReport(null, 10, 0);

    assertThat(unassigned).hasSize(1);
    final EventRecord event = unassigned.get(0);
    assertThat(event.id()).isEqualTo(id);
    assertThat(event.isUnassigned()).isTrue();
    assertThat(event.objectId()).isEqualTo(42L);
    assertThat(event.eventTimestamp()).isEqualTo(BASE_TIME);
    assertThat(event.eventDataJson()).contains("\"title\"").contains("Hello");
  }

  @Test
  void claimIncludesBothBoundsAndIsIdempotent() {
    final long reportId = reportRepository.insertActive(BASE_TIME, BASE_TIME);
    insert("post_published", BASE_TIME.minusSeconds(1));
    final long atStart = insert("post_published", BASE_TIME);
    final long atEnd = insert("comment_posted", BASE_TIME.plusSeconds(60));
    insert("comment_posted", BASE_TIME.plusSeconds(61));

    final int first = eventRepository.claimForPeriod(reportId, BASE_TIME, BASE_TIME.plusSeconds(60));
    final int second =
        eventRepository.claimForPeriod(reportId, BASE_TIME, BASE_TIME.plusSeconds(60));

    assertThat(first).isEqualTo(2);
    assertThat(second).isZero();
    assertThat(eventRepository.findAllByReport(reportId))
        .extracting(EventRecord::id)
        .containsExactlyInAnyOrder(atStart, atEnd);
    assertThat(eventRepository.countUnassigned()).isEqualTo(2);
  }

  @Test
  void claimNeverReassignsEventsOwnedByAnotherReport() {
    final long first = reportRepository.insertActive(BASE_TIME, BASE_TIME);
    insert("post_published", BASE_TIME.plusSeconds(10));
    eventRepository.claimForPeriod(first, BASE_TIME, BASE_TIME.plusSeconds(20));
    reportRepository.markFrozen(first, BASE_TIME.plusSeconds(20), BASE_TIME.plusSeconds(20), 1, "{}");
    final long second = reportRepository.insertActive(BASE_TIME, BASE_TIME);

    final int claimed = eventRepository.claimForPeriod(second, BASE_TIME, BASE_TIME.plusSeconds(20));

    assertThat(claimed).isZero();
    assertThat(eventRepository.findAllByReport(first)).hasSize(1);
  }

  @Test
  void countByTypeOrdersByCountThenType() {
    insert("user_registered", BASE_TIME);
    insert("comment_posted", BASE_TIME);
    insert("comment_posted", BASE_TIME);
    insert("core_updated", BASE_TIME);

    final Map<String, Long> counts = eventRepository.countByType(null);

    assertThat(counts)
        .containsExactly(
            Map.entry("comment_posted", 2L),
            Map.entry("core_updated", 1L),
            Map.entry("user_registered", 1L));
  }

  @Test
  void findByTypeMatchesSubstringAndEscapesWildcards() {
    insert("comment_posted", BASE_TIME);
    insert("comment_approved", BASE_TIME.plusSeconds(1));
    insert("post_published", BASE_TIME.plusSeconds(2));

    assertThat(eventRepository.findByType("comment", null, 10))
        .extracting(EventRecord::eventType)
        .containsExactly("comment_approved", "comment_posted");
    assertThat(eventRepository.findByType("%", null, 10)).isEmpty();
  }

  @Test
  void findLastEventForReturnsNewestEventOfObject() {
    insert("post_edited", 42L, BASE_TIME);
    final long newest = insert("post_edited", 42L, BASE_TIME.plusSeconds(30));
    insert("post_edited", 43L, BASE_TIME.plusSeconds(60));

    assertThat(eventRepository.findLastEventFor("post_edited", 42L))
        .get()
        .extracting(EventRecord::id)
        .isEqualTo(newest);
    assertThat(eventRepository.findLastEventFor("post_edited", 99L)).isEmpty();
  }

  @Test
  void recentUnassignedIsEvictedOnInsert() {
    insert("post_published", BASE_TIME);
    assertThat(eventRepository.findRecentUnassigned(10)).hasSize(1);

    insert("post_published", BASE_TIME.plusSeconds(1));

    assertThat(eventRepository.findRecentUnassigned(10)).hasSize(2);
  }

  private long insert(String eventType, Instant timestamp) {
    return insert(eventType, null, timestamp);
  }

  private long insert(String eventType, Long objectId, Instant timestamp) {
    return eventRepository.insert(
        new EventDraft(eventType, null, objectId, null, null, "core", timestamp));
  }
}
