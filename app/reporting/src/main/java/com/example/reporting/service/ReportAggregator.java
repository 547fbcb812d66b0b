/*
 * どこで: Reporting サービス層
 * 何を: 期間内イベントから件数/前回比/ハイライト/上位投稿者を集計する
 * なぜ: 締め時に不変の summary_data を1回の計算で確定させるため
 */
package com.example.reporting.service;

import com.example.reporting.model.AuthorCount;
import com.example.reporting.model.EventRecord;
import com.example.reporting.model.ReportSummary;
import com.example.reporting.model.TrendDirection;
import com.example.reporting.model.TrendEntry;
import com.example.reporting.narrative.NarrativeGenerator;
import com.google.common.annotations.VisibleForTesting;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReportAggregator {

  private static final Logger logger = LoggerFactory.getLogger(ReportAggregator.class);
  private static final Set<String> AUTHORED_EVENT_TYPES = Set.of("post_published", "page_published");
  private static final int TOP_AUTHOR_LIMIT = 5;
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final EventTypeCatalog eventTypeCatalog;
  private final EventDataCodec eventDataCodec;
  private final NarrativeGenerator narrativeGenerator;
  private final ReportingMetrics metrics;

  /**
   * 純粋な集計。ストアには触れない。
   *
   * @param events 対象期間のイベント(新しい順)
   * @param previousTotals 直前に締めたレポートの totals。初回は空
   */
  public ReportSummary summarize(List<EventRecord> events, Map<String, Long> previousTotals) {
    final Map<String, Long> totals = countByType(events);
    final boolean firstReport = previousTotals.isEmpty();
    final Map<String, TrendEntry> trends =
        firstReport ? Map.of() : computeTrends(totals, previousTotals);
    final List<String> highlights = buildHighlights(totals);
    final List<AuthorCount> topAuthors = topAuthors(events);
    final String narrative = generateNarrative(events, totals, trends).orElse(null);
    return new ReportSummary(
        events.size(), totals, trends, highlights, topAuthors, firstReport, narrative);
  }

  @VisibleForTesting
  Map<String, Long> countByType(List<EventRecord> events) {
    final Map<String, Long> counts =
        events.stream()
            .collect(Collectors.groupingBy(EventRecord::eventType, Collectors.counting()));
    // 件数の多い順、同数は種別名の昇順
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Long>comparingByValue()
                .reversed()
                .thenComparing(Map.Entry.comparingByKey()))
        .collect(
            Collectors.toMap(
                Map.Entry::getKey, Map.Entry::getValue, (left, right) -> left, LinkedHashMap::new));
  }

  @VisibleForTesting
  Map<String, TrendEntry> computeTrends(Map<String, Long> totals, Map<String, Long> previousTotals) {
    final Set<String> types = new LinkedHashSet<>(totals.keySet());
    previousTotals.keySet().stream().sorted().forEach(types::add);

    final Map<String, TrendEntry> trends = new LinkedHashMap<>();
    for (String type : types) {
      final long current = totals.getOrDefault(type, 0L);
      final long previous = previousTotals.getOrDefault(type, 0L);
      if (previous <= 0) {
        // 基準値 0 の比率は定義できないので載せない
        continue;
      }
      trends.put(
          type,
          new TrendEntry(
              current,
              previous,
              changePercent(current, previous),
              TrendDirection.of(Long.signum(current - previous))));
    }
    return trends;
  }

  @VisibleForTesting
  static double changePercent(long current, long previous) {
    return BigDecimal.valueOf(current - previous)
        .multiply(HUNDRED)
        .divide(BigDecimal.valueOf(previous), 1, RoundingMode.HALF_UP)
        .doubleValue();
  }

  @VisibleForTesting
  List<String> buildHighlights(Map<String, Long> totals) {
    return totals.entrySet().stream()
        .filter(entry -> entry.getValue() > 0)
        .sorted(
            Comparator.<Map.Entry<String, Long>>comparingInt(
                    entry -> eventTypeCatalog.priorityOf(entry.getKey()))
                .thenComparing(Map.Entry::getKey))
        .map(entry -> eventTypeCatalog.highlight(entry.getKey(), entry.getValue()))
        .toList();
  }

  @VisibleForTesting
  List<AuthorCount> topAuthors(List<EventRecord> events) {
    final Map<String, Long> counts =
        events.stream()
            .filter(event -> AUTHORED_EVENT_TYPES.contains(event.eventType()))
            .map(this::authorOf)
            .flatMap(Optional::stream)
            .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    return counts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Long>comparingByValue()
                .reversed()
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(TOP_AUTHOR_LIMIT)
        .map(entry -> new AuthorCount(entry.getKey(), entry.getValue()))
        .toList();
  }

  private Optional<String> authorOf(EventRecord event) {
    try {
      return EventDataCodec.textAt(
          eventDataCodec.read(event.eventDataJson()), "context", "user_name");
    } catch (IllegalArgumentException ex) {
      logger.warn("event_data unreadable; author skipped eventId={}", event.id(), ex);
      return Optional.empty();
    }
  }

  private Optional<String> generateNarrative(
      List<EventRecord> events, Map<String, Long> totals, Map<String, TrendEntry> trends) {
    if (events.isEmpty()) {
      return Optional.empty();
    }
    try {
      return narrativeGenerator
          .generate(events, totals, trends)
          .filter(text -> !text.isBlank());
    } catch (RuntimeException ex) {
      // ナラティブの失敗で締めを止めない
      metrics.recordNarrativeFailure();
      logger.warn("narrative generation failed; summary stored without narrative", ex);
      return Optional.empty();
    }
  }
}
