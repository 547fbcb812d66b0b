/*
 * どこで: Reporting API
 * 何を: レポート1件の表現
 * なぜ: summary_data を解析済みの構造で下流へ渡すため
 */
package com.example.reporting.api;

import com.example.reporting.model.ReportSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReportResponse(
    long id,
    String status,
    Instant periodStart,
    Instant periodEnd,
    Instant frozenAt,
    int eventCount,
    ReportSummary summary,
    boolean emailed,
    Instant emailedAt,
    Instant createdAt) {}
