/*
 * どこで: Reporting API
 * 何を: 締め済みレポート一覧のレスポンスを表す
 */
package com.example.reporting.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReportsResponse(List<ReportResponse> reports, int limit, int offset) {
  public ReportsResponse {
    reports = reports == null ? List.of() : List.copyOf(reports);
  }
}
