/*
 * どこで: Reporting 集計モデル
 * 何を: summary_data に保存する集計結果
 * なぜ: 締め後に不変となるレポート本文の形を固定し、下流の読み手と共有するため
 */
package com.example.reporting.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReportSummary(
    int totalEvents,
    Map<String, Long> totals,
    Map<String, TrendEntry> trends,
    List<String> highlights,
    List<AuthorCount> topAuthors,
    boolean firstReport,
    @JsonInclude(JsonInclude.Include.NON_NULL) String narrative) {

  public ReportSummary {
    totals = totals == null ? Map.of() : totals;
    trends = trends == null ? Map.of() : trends;
    highlights = highlights == null ? List.of() : List.copyOf(highlights);
    topAuthors = topAuthors == null ? List.of() : List.copyOf(topAuthors);
  }
}
