/*
 * どこで: Reporting ドメインモデル
 * 何を: reports テーブルのスナップショット
 * なぜ: 締め処理と参照 API で共通化するため
 */
package com.example.reporting.model;

import java.time.Instant;

public record ReportRecord(
    long id,
    ReportStatus status,
    Instant periodStart,
    Instant periodEnd,
    Instant frozenAt,
    int eventCount,
    String summaryJson,
    boolean emailed,
    Instant emailedAt,
    Instant createdAt) {

  public boolean isActive() {
    return status == ReportStatus.ACTIVE && periodEnd == null;
  }
}
