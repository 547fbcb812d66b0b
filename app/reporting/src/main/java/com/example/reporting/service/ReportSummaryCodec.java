/*
 * どこで: Reporting サービス層
 * 何を: ReportSummary と summary_data(JSON)を相互変換する
 * なぜ: 前回レポートの totals をトレンドの基準値として読み戻すため
 */
package com.example.reporting.service;

import com.example.reporting.model.ReportRecord;
import com.example.reporting.model.ReportSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ReportSummaryCodec {

  private static final String FIELD_TOTALS = "totals";

  private final ObjectMapper objectMapper;

  public String write(ReportSummary summary) {
    try {
      return objectMapper.writeValueAsString(summary);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize report summary", ex);
    }
  }

  public Optional<ReportSummary> read(ReportRecord report) {
    if (report.summaryJson() == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(report.summaryJson(), ReportSummary.class));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse summary_data reportId=" + report.id(), ex);
    }
  }

  public Map<String, Long> readTotals(ReportRecord report) {
    final Map<String, Long> totals = new LinkedHashMap<>();
    if (report.summaryJson() == null) {
      return totals;
    }
    try {
      // totals 以外のフィールド構成が変わっても基準値だけは読めるよう木構造で辿る
      final JsonNode totalsNode = objectMapper.readTree(report.summaryJson()).path(FIELD_TOTALS);
      final Iterator<Map.Entry<String, JsonNode>> fields = totalsNode.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        totals.put(field.getKey(), field.getValue().asLong());
      }
      return totals;
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse summary_data reportId=" + report.id(), ex);
    }
  }
}
